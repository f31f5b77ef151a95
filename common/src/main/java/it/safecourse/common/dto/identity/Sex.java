package it.safecourse.common.dto.identity;

/**
 * Sex as encoded in the day field of a fiscal code.
 */
public enum Sex {
    M,
    F
}
