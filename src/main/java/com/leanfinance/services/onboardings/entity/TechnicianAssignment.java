package com.leanfinance.services.onboardings.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * A technician candidate stored on a record: the CRM user id and the contact
 * property it was read from.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class TechnicianAssignment {

    @Column(name = "hubspot_tec_id", nullable = false, length = 50)
    private String hubspotTecId;

    @Column(name = "property_name", nullable = false, length = 100)
    private String propertyName;
}
