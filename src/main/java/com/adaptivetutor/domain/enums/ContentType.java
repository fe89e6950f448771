package com.adaptivetutor.domain.enums;

/**
 * Kind of learning content the content service is asked to deliver.
 */
public enum ContentType {
    THEORY,
    GUIDED_WALKTHROUGH,
    PRACTICAL,
    CHALLENGE,
    ASSESSMENT
}
