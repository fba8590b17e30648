package com.ttp.trust.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO form of a graph fixture file.
 *
 * <p>
 * Principals carry a hex key seed instead of a public key; the loader derives
 * the key pair and signs every record on load. Timestamps are ISO-8601
 * instants or offsets from the load clock such as {@code now}, {@code now-40d}
 * or {@code now+2h}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphFixture {
    private String name;
    private List<DomainDef> domains = new ArrayList<>();
    private List<PrincipalDef> principals = new ArrayList<>();
    private List<SubjectDef> subjects = new ArrayList<>();
    private List<EdgeDef> trustEdges = new ArrayList<>();
    private List<EndorsementDef> endorsements = new ArrayList<>();
    private List<DistrustDef> distrustEdges = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class DomainDef {
        private String id, parent, name;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PrincipalDef {
        private String id;
        private String type = "USER";
        private String algorithm = "ed25519";
        /** 32-byte hex seed; a random key is generated when absent. */
        private String seed;
        private String createdAt = "now-365d";
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SubjectDef {
        private String id;
        private String type = "BUSINESS";
        private List<String> domains;
        private Map<String, String> externalIds;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EdgeDef {
        private String from, to, domain;
        private double weight;
        private String issuedAt = "now-1d";
        private String expiresAt;
        /** Corrupts the signature after signing. */
        private boolean tampered;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EndorsementDef {
        private String from, subject, domain;
        private double weight;
        private String issuedAt = "now-1d";
        private String expiresAt;
        private boolean tampered;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DistrustDef {
        private String from, to, domain;
        private String reason = "other";
        private String issuedAt = "now-1d";
        private String expiresAt;
        private boolean tampered;
    }
}
