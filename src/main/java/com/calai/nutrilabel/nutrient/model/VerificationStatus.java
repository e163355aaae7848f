package com.calai.nutrilabel.nutrient.model;

public enum VerificationStatus {
    VERIFIED,
    NEEDS_REVIEW,
    REJECTED
}
