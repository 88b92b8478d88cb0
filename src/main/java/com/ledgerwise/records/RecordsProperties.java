package com.ledgerwise.records;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ledgerwise.records")
public class RecordsProperties {

    /** Location of the JSON seed for employees and reimbursements. */
    private String seed = "classpath:/seed/records.json";

    public String getSeed() {
        return seed;
    }

    public void setSeed(String seed) {
        this.seed = seed;
    }
}
