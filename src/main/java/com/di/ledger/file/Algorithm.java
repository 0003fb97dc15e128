package com.di.ledger.file;

import com.di.ledger.exception.ValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Producing application of a file. Identified by (appName, appVer, appFam, psetHash);
 * files sharing that tuple share one algorithm row. The raw configuration content
 * travels with the tuple but is not part of its identity.
 */
@Value
public class Algorithm {

    String appName;
    String appVer;
    String appFam;
    String psetHash;

    @EqualsAndHashCode.Exclude
    String configContent;

    @Builder
    public Algorithm(String appName, String appVer, String appFam, String psetHash, String configContent) {
        requireText(appName, "appName");
        requireText(appVer, "appVer");
        requireText(appFam, "appFam");
        requireText(psetHash, "psetHash");
        this.appName = appName;
        this.appVer = appVer;
        this.appFam = appFam;
        this.psetHash = psetHash;
        this.configContent = configContent;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Algorithm " + field + " cannot be blank");
        }
    }
}
