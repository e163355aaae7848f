package com.calai.nutrilabel.label.evidence;

public record VerificationStatusSummary(int verified, int needsReview, int rejected) {}
