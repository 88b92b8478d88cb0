package com.ledgerwise.records;

/**
 * An employee directory entry.
 *
 * @param employeeId unique id, e.g. E001
 * @param name       full name
 * @param department department name
 * @param position   job title
 * @param email      work email address
 */
public record Employee(
    String employeeId,
    String name,
    String department,
    String position,
    String email
) {}
