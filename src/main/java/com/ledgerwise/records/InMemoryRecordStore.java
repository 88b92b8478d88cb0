package com.ledgerwise.records;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory employee directory, reimbursement ledger and work order desk,
 * seeded from a JSON document at startup.
 */
@Component
public class InMemoryRecordStore implements EmployeeDirectory, ReimbursementLedger, WorkOrderDesk {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRecordStore.class);
    private static final DateTimeFormatter WORK_ORDER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    /** Shape of the seed document. */
    public record Seed(List<Employee> employees, List<Reimbursement> reimbursements) {}

    private final Map<String, Employee> employees = new LinkedHashMap<>();
    private final List<Reimbursement> reimbursements;
    private final List<WorkOrder> workOrders = new ArrayList<>();
    private final Clock clock;
    private int workOrderSequence;

    @Autowired
    public InMemoryRecordStore(RecordsProperties properties, ResourceLoader resourceLoader, Clock clock)
            throws IOException {
        this(readSeed(resourceLoader.getResource(properties.getSeed())), clock);
    }

    public InMemoryRecordStore(Seed seed, Clock clock) {
        this.clock = clock;
        if (seed.employees() != null) {
            seed.employees().forEach(e -> employees.put(e.employeeId().toUpperCase(Locale.ROOT), e));
        }
        this.reimbursements = seed.reimbursements() == null ? List.of() : List.copyOf(seed.reimbursements());
        log.info("Record store loaded {} employees and {} reimbursements", employees.size(), reimbursements.size());
    }

    public static Seed readSeed(InputStream in) throws IOException {
        var mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper.readValue(in, Seed.class);
    }

    private static Seed readSeed(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return readSeed(in);
        }
    }

    // ── EmployeeDirectory ────────────────────────────────────────────

    @Override
    public Optional<Employee> findById(String employeeId) {
        if (employeeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(employees.get(employeeId.trim().toUpperCase(Locale.ROOT)));
    }

    @Override
    public List<Employee> findByName(String name) {
        if (name == null || name.isBlank()) {
            return List.of();
        }
        String query = name.trim();
        List<Employee> exact = employees.values().stream()
                .filter(e -> e.name().equalsIgnoreCase(query))
                .toList();
        if (!exact.isEmpty()) {
            return exact;
        }
        List<String> queryParts = Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\s+")).toList();
        return employees.values().stream()
                .filter(e -> Arrays.asList(e.name().toLowerCase(Locale.ROOT).split("\\s+")).containsAll(queryParts))
                .toList();
    }

    // ── ReimbursementLedger ──────────────────────────────────────────

    @Override
    public List<Reimbursement> findByEmployee(String employeeId, LocalDate from, LocalDate to) {
        return reimbursements.stream()
                .filter(r -> r.employeeId().equalsIgnoreCase(employeeId))
                .filter(r -> from == null || !r.submittedOn().isBefore(from))
                .filter(r -> to == null || !r.submittedOn().isAfter(to))
                .sorted(Comparator.comparing(Reimbursement::submittedOn).thenComparing(Reimbursement::reimbursementId))
                .toList();
    }

    // ── WorkOrderDesk ────────────────────────────────────────────────

    @Override
    public synchronized Receipt open(String subject, String assigneeId, String priority, String category) {
        for (WorkOrder existing : workOrders) {
            if (existing.isActive()
                    && existing.assigneeId().equalsIgnoreCase(assigneeId)
                    && existing.subject().equalsIgnoreCase(subject.trim())) {
                log.info("Work order {} already open for {} / '{}'", existing.workOrderId(), assigneeId, subject);
                return new Receipt(existing, false);
            }
        }
        var now = clock.instant();
        String id = "WO" + WORK_ORDER_DATE.format(now.atOffset(ZoneOffset.UTC))
                + "-" + String.format("%04d", ++workOrderSequence);
        var order = new WorkOrder(id, subject.trim(), assigneeId.toUpperCase(Locale.ROOT), priority, category, "open", now);
        workOrders.add(order);
        log.info("Opened work order {} for {}", id, order.assigneeId());
        return new Receipt(order, true);
    }

    public synchronized List<WorkOrder> workOrders() {
        return List.copyOf(workOrders);
    }
}
