package com.ledgerwise.records;

import java.util.List;
import java.util.Optional;

/**
 * Read access to employee records.
 */
public interface EmployeeDirectory {

    Optional<Employee> findById(String employeeId);

    /**
     * Finds employees by name. An exact (case-insensitive) full-name match
     * wins; otherwise every employee with a matching name part is returned.
     */
    List<Employee> findByName(String name);
}
