package com.leanfinance.services.onboardings.constants;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Internal service lines.
 *
 * Departments with technician properties resolve their technician from the
 * contact's "assigned" CRM properties. The rest always fall back to the
 * department responsible.
 */
@Getter
public enum Department {

    SU("Financiación Pública",
            List.of("tecnico_enisa_asignado", "tecnico_subvencion_asignado"),
            "03 - Financiación Pública"),
    FI("CFO",
            List.of("cfo_asignado", "cfo_asignado_ii"),
            "01 - CFO"),
    AS("Asesoría fiscal",
            List.of("asesor_fiscal_asignado", "administrativo_asignado"),
            "02 - Asesoría fiscal, contable y laboral"),
    LA("Asesoría laboral",
            List.of("asesor_laboral_asignado"),
            "02 - Asesoría fiscal, contable y laboral"),
    LE("Legal", List.of(), null),
    DA("Servicios DATA", List.of(), null),
    DI("Diseño", List.of(), null);

    private final String label;
    private final List<String> technicianProperties;
    private final String driveSubfolder;

    Department(String label, List<String> technicianProperties, String driveSubfolder) {
        this.label = label;
        this.technicianProperties = technicianProperties;
        this.driveSubfolder = driveSubfolder;
    }

    public boolean hasTechnicianProperties() {
        return !technicianProperties.isEmpty();
    }

    public boolean hasDriveSubfolder() {
        return driveSubfolder != null;
    }

    /**
     * @throws IllegalArgumentException for blank or unknown codes
     */
    public static Department fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Department code is blank");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(d -> d.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown department code: " + code));
    }

    public static boolean isKnownCode(String code) {
        if (code == null) return false;
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).anyMatch(d -> d.name().equals(normalized));
    }
}
