package com.phiprotection.domain.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Taxonomy of record keys that carry protected health information.
 *
 * <p>Keys are matched exactly against JSON property names at any depth of a record.
 * A key that is not listed here is never transformed.
 */
public enum PhiField {

    // Identity
    FIRST_NAME("firstName", PhiCategory.IDENTITY),
    LAST_NAME("lastName", PhiCategory.IDENTITY),
    MIDDLE_NAME("middleName", PhiCategory.IDENTITY),
    PREFERRED_NAME("preferredName", PhiCategory.IDENTITY),
    DATE_OF_BIRTH("dateOfBirth", PhiCategory.IDENTITY),
    DOB("dob", PhiCategory.IDENTITY),
    BIRTH_DATE("birthDate", PhiCategory.IDENTITY),
    SSN("ssn", PhiCategory.IDENTITY),
    SOCIAL_SECURITY_NUMBER("socialSecurityNumber", PhiCategory.IDENTITY),
    EMAIL("email", PhiCategory.IDENTITY),
    PHONE("phone", PhiCategory.IDENTITY),
    MOBILE_PHONE("mobilePhone", PhiCategory.IDENTITY),
    ADDRESS("address", PhiCategory.IDENTITY),
    STREET("street", PhiCategory.IDENTITY),
    CITY("city", PhiCategory.IDENTITY),
    POSTAL_CODE("postalCode", PhiCategory.IDENTITY),
    ZIP_CODE("zipCode", PhiCategory.IDENTITY),
    EMERGENCY_CONTACT("emergencyContact", PhiCategory.IDENTITY),
    MEDICAL_RECORD_NUMBER("medicalRecordNumber", PhiCategory.IDENTITY),
    MRN("mrn", PhiCategory.IDENTITY),

    // Clinical
    DIAGNOSIS("diagnosis", PhiCategory.CLINICAL),
    DIAGNOSES("diagnoses", PhiCategory.CLINICAL),
    CONDITIONS("conditions", PhiCategory.CLINICAL),
    MEDICATIONS("medications", PhiCategory.CLINICAL),
    ALLERGIES("allergies", PhiCategory.CLINICAL),
    LABS("labs", PhiCategory.CLINICAL),
    VITALS("vitals", PhiCategory.CLINICAL),
    PROCEDURES("procedures", PhiCategory.CLINICAL),
    CHIEF_COMPLAINT("chiefComplaint", PhiCategory.CLINICAL),
    DICTATION("dictation", PhiCategory.CLINICAL),
    SOAP_NOTE("soapNote", PhiCategory.CLINICAL),
    NOTES("notes", PhiCategory.CLINICAL),
    ASSESSMENT("assessment", PhiCategory.CLINICAL),
    PLAN("plan", PhiCategory.CLINICAL),

    // Mental health
    MENTAL_HEALTH_NOTES("mentalHealthNotes", PhiCategory.MENTAL_HEALTH),
    SCREENING_SCORES("screeningScores", PhiCategory.MENTAL_HEALTH),
    PHQ9("phq9", PhiCategory.MENTAL_HEALTH),
    GAD7("gad7", PhiCategory.MENTAL_HEALTH),
    SUBSTANCE_USE("substanceUse", PhiCategory.MENTAL_HEALTH),
    PSYCHIATRIC_HISTORY("psychiatricHistory", PhiCategory.MENTAL_HEALTH),

    // Insurance
    INSURANCE("insurance", PhiCategory.INSURANCE),
    INSURANCE_ID("insuranceId", PhiCategory.INSURANCE),
    INSURANCE_PROVIDER("insuranceProvider", PhiCategory.INSURANCE),
    POLICY_NUMBER("policyNumber", PhiCategory.INSURANCE),
    GROUP_NUMBER("groupNumber", PhiCategory.INSURANCE),
    MEMBER_ID("memberId", PhiCategory.INSURANCE),
    SUBSCRIBER_NAME("subscriberName", PhiCategory.INSURANCE);

    private static final Map<String, PhiField> BY_JSON_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(PhiField::getJsonName, Function.identity()));

    private final String jsonName;
    private final PhiCategory category;

    PhiField(String jsonName, PhiCategory category) {
        this.jsonName = jsonName;
        this.category = category;
    }

    public String getJsonName() {
        return jsonName;
    }

    public PhiCategory getCategory() {
        return category;
    }

    public static Optional<PhiField> fromJsonName(String name) {
        return Optional.ofNullable(name == null ? null : BY_JSON_NAME.get(name));
    }

    public static boolean isSensitiveKey(String name) {
        return name != null && BY_JSON_NAME.containsKey(name);
    }

    public static Set<PhiField> all() {
        return Collections.unmodifiableSet(EnumSet.allOf(PhiField.class));
    }

    public static Set<PhiField> inCategories(PhiCategory... categories) {
        Set<PhiCategory> wanted = EnumSet.noneOf(PhiCategory.class);
        wanted.addAll(Arrays.asList(categories));
        EnumSet<PhiField> fields = EnumSet.noneOf(PhiField.class);
        for (PhiField field : values()) {
            if (wanted.contains(field.category)) {
                fields.add(field);
            }
        }
        return Collections.unmodifiableSet(fields);
    }
}
