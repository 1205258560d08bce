package com.ledgerindexer.ingestion.config;

import com.ledgerindexer.domain.MergePolicy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Smart contract the event and object lanes index. Package address defaults to SMART_CONTRACT_ADDRESS in application.yml.
 */
@ConfigurationProperties(prefix = "ledgerindexer.contract")
@NoArgsConstructor
@Getter
@Setter
public class ContractProperties {

    /** Package address; blank indexes events and objects of every package. */
    private String packageAddress;

    /** VERSIONED_MERGE keeps the highest object version; REPLACE_ON_CONFLICT keeps the last one written. */
    private MergePolicy objectMergePolicy = MergePolicy.VERSIONED_MERGE;

    public boolean hasPackageAddress() {
        return packageAddress != null && !packageAddress.isBlank();
    }
}
