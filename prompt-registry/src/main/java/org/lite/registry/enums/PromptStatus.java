package org.lite.registry.enums;

public enum PromptStatus {
    DRAFT,      // Being edited, never deployed
    REVIEW,     // Awaiting review
    STAGED,     // Deployed to a staging environment
    DEPLOYED,   // Deployed to production
    ARCHIVED    // Retired, kept for history
}
