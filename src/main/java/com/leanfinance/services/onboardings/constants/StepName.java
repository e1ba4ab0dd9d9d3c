package com.leanfinance.services.onboardings.constants;

/**
 * Provisioning steps of an onboarding, in execution order.
 * The email goes last because it links to what the earlier steps created.
 */
public enum StepName {
    CREATE_DRIVE_FOLDER,    // shared-drive folder + department sub-folder
    CREATE_HOLDED_CONTACT,  // billing contact in Holded
    NOTIFY_SLACK,           // DM to the assigned technician
    SEND_EMAIL              // summary email to the assigned technician
}
