package com.leanfinance.services.onboardings.constants;

import java.util.List;

/**
 * Application-wide constants for the onboardings service
 */
public final class OnboardingConstants {

    private OnboardingConstants() {
        throw new IllegalStateException("Constants class cannot be instantiated");
    }

    // API Versioning
    public static final String API_V1 = "/api/v1";

    // Deal name separators, most specific first
    public static final List<String> DEAL_NAME_SEPARATORS = List.of(" - ", " -", "- ", "-");

    // CRM properties
    public static final List<String> DEAL_PROPERTIES = List.of(
            "dealname", "amount", "hubspot_owner_id", "pipeline", "dealstage", "closedate");

    public static final List<String> COMPANY_PROPERTIES = List.of(
            "name", "nif", "generic_email", "phone", "address", "city", "state", "zip",
            "country", "website", "domain", "tl_holded_id", "tl_synced_holded",
            "drive_folder_id", "drive_folder_url");

    /** Contact properties holding an assigned technician's CRM user id, in CRM order. */
    public static final List<String> TECHNICIAN_PROPERTIES = List.of(
            "tecnico_enisa_asignado",
            "tecnico_subvencion_asignado",
            "cfo_asignado",
            "cfo_asignado_ii",
            "asesor_fiscal_asignado",
            "asesor_laboral_asignado",
            "administrativo_asignado");

    public static final List<String> CONTACT_BASE_PROPERTIES = List.of(
            "firstname", "lastname", "nombre_y_apellidos", "email", "phone",
            "mobilephone", "cargo_en_empresa", "nif");

    // Company write-back keys
    public static final String PROP_DRIVE_FOLDER_ID = "drive_folder_id";
    public static final String PROP_DRIVE_FOLDER_URL = "drive_folder_url";
    public static final String PROP_HOLDED_ID = "tl_holded_id";

    // Step result payload keys
    public static final String DATA_DRIVE_FOLDER_ID = "drive_folder_id";
    public static final String DATA_DRIVE_FOLDER_URL = "drive_folder_url";
    public static final String DATA_DRIVE_SUBFOLDER_ID = "drive_subfolder_id";
    public static final String DATA_HOLDED_CONTACT_ID = "holded_contact_id";
    public static final String DATA_HOLDED_CONTACT_URL = "holded_contact_url";
    public static final String DATA_SLACK_MESSAGE_TS = "slack_message_ts";
    public static final String DATA_GMAIL_MESSAGE_ID = "gmail_message_id";

    // Spreadsheet ranges
    public static final String RANGE_TEAM_MEMBERS = "usuarios!A:G";
    public static final String RANGE_SERVICES = "servicios!A:C";

    // Links
    public static final String HUBSPOT_DEAL_URL = "https://app.hubspot.com/contacts/%s/deal/%s";
    public static final String DRIVE_FOLDER_URL = "https://drive.google.com/drive/folders/%s";
    public static final String HOLDED_CONTACT_URL = "https://app.holded.com/contacts/%s";

    // Admin email subjects
    public static final String SUBJECT_PREFIX = "[LeanFinance Onboardings]";
}
