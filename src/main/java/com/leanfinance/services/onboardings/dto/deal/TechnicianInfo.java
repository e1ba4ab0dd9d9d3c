package com.leanfinance.services.onboardings.dto.deal;

/**
 * A technician candidate read from the contact: the HubSpot user id and the
 * property it came from.
 */
public record TechnicianInfo(String hubspotTecId, String propertyName) {
}
