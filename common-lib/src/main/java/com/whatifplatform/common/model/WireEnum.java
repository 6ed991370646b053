package com.whatifplatform.common.model;

/**
 * Enumeration with a fixed lowercase wire value.
 */
public interface WireEnum {

    String value();
}
