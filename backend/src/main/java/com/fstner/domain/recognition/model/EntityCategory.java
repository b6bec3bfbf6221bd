package com.fstner.domain.recognition.model;

/**
 * Categories emitted by the built-in definition set.
 * Extension definitions may emit any other category code.
 */
public enum EntityCategory {
    PERSON,
    POSTALCODE,
    CITY,
    ADDRESS,
    PRICE,
    EMAIL,
    DATE,
    PHONE_NUMBER,
    URL,
    NUMBER;

    public String code() {
        return name();
    }
}
