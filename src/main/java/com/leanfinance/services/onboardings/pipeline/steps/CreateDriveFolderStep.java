package com.leanfinance.services.onboardings.pipeline.steps;

import com.leanfinance.services.onboardings.client.GoogleDriveClient;
import com.leanfinance.services.onboardings.client.HubSpotClient;
import com.leanfinance.services.onboardings.config.OnboardingConfig;
import com.leanfinance.services.onboardings.constants.Department;
import com.leanfinance.services.onboardings.constants.OnboardingConstants;
import com.leanfinance.services.onboardings.constants.StepName;
import com.leanfinance.services.onboardings.dto.deal.CompanyInfo;
import com.leanfinance.services.onboardings.pipeline.PipelineStep;
import com.leanfinance.services.onboardings.pipeline.StepContext;
import com.leanfinance.services.onboardings.pipeline.StepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Client folder on the shared drive, plus the department sub-folder when the
 * department has one.
 *
 * The client folder id lives on the HubSpot company (drive_folder_id), so a
 * client onboarded for a second service reuses its folder. The sub-folder is
 * looked up by name inside it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CreateDriveFolderStep extends PipelineStep {

    private final GoogleDriveClient driveClient;
    private final HubSpotClient hubSpotClient;
    private final OnboardingConfig onboardingConfig;

    @Override
    public StepName name() {
        return StepName.CREATE_DRIVE_FOLDER;
    }

    @Override
    public boolean checkAlreadyDone(StepContext ctx) {
        CompanyInfo company = ctx.getCompany();
        if (company == null || company.getDriveFolderId() == null) {
            return false;
        }

        Department department = ctx.getDepartment();
        if (department != null && department.hasDriveSubfolder()) {
            Optional<String> subfolder = driveClient.findFolder(
                    department.getDriveSubfolder(), company.getDriveFolderId());
            if (subfolder.isEmpty()) {
                // client folder exists, sub-folder still missing
                return false;
            }
            ctx.setDriveSubfolderId(subfolder.get());
        }

        ctx.setDriveFolderId(company.getDriveFolderId());
        ctx.setDriveFolderUrl(company.getDriveFolderUrl() != null
                ? company.getDriveFolderUrl()
                : GoogleDriveClient.folderUrl(company.getDriveFolderId()));
        return true;
    }

    @Override
    public StepResult execute(StepContext ctx) {
        CompanyInfo company = ctx.getCompany();
        boolean folderKnown = company != null && company.getDriveFolderId() != null;

        String clientFolderId;
        if (folderKnown) {
            clientFolderId = company.getDriveFolderId();
            log.info("Drive client folder already exists: dealId={}, folderId={}", ctx.getDealId(), clientFolderId);
        } else {
            clientFolderId = driveClient.findOrCreateFolder(
                    ctx.getCompanyName(), onboardingConfig.getDriveParentFolderId());
            log.info("Drive client folder ready: dealId={}, folderId={}", ctx.getDealId(), clientFolderId);
        }
        ctx.setDriveFolderId(clientFolderId);
        ctx.setDriveFolderUrl(GoogleDriveClient.folderUrl(clientFolderId));

        if (company != null && !folderKnown) {
            hubSpotClient.updateCompany(company.getHubspotId(), Map.of(
                    OnboardingConstants.PROP_DRIVE_FOLDER_ID, clientFolderId,
                    OnboardingConstants.PROP_DRIVE_FOLDER_URL, ctx.getDriveFolderUrl()));
        }

        Department department = ctx.getDepartment();
        if (department != null && department.hasDriveSubfolder()) {
            String subfolderId = driveClient.findOrCreateFolder(department.getDriveSubfolder(), clientFolderId);
            ctx.setDriveSubfolderId(subfolderId);
            log.info("Drive sub-folder ready: dealId={}, name='{}', folderId={}",
                    ctx.getDealId(), department.getDriveSubfolder(), subfolderId);
        }

        return StepResult.success(payload(ctx));
    }

    @Override
    protected StepResult skippedResult(StepContext ctx) {
        return StepResult.skipped(payload(ctx));
    }

    private Map<String, Object> payload(StepContext ctx) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(OnboardingConstants.DATA_DRIVE_FOLDER_ID, ctx.getDriveFolderId());
        data.put(OnboardingConstants.DATA_DRIVE_FOLDER_URL, ctx.getDriveFolderUrl());
        data.put(OnboardingConstants.DATA_DRIVE_SUBFOLDER_ID, ctx.getDriveSubfolderId());
        return data;
    }
}
