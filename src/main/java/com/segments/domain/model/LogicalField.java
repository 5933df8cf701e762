package com.segments.domain.model;

import java.util.List;

/**
 * Reporting-schema fields and the physical spellings they may appear under.
 * Candidates are tried in declaration order.
 */
public enum LogicalField {

    SEGMENT("Segment", "Segment", "segment"),
    NAME("Name", "Name", "name"),
    EMAIL("Email", "Email", "email"),
    PHONE("Phone", "Phone", "phone"),
    USER_ID("User ID", "User ID", "user_id"),
    REGISTERED_DATE("Registered Date", "Registered Date", "registered_date"),
    CASH_BALANCE("Cash Balance", "Cash Balance", "cash_balance"),
    TOTAL_CONTESTS_JOINED("Total Contests Joined", "Total Contests Joined", "total_contests_joined"),
    IPL_CONTESTS("IPL Contests", "IPL Contests", "ipl_contests"),
    HIGHEST_IPL_SCORE("Highest IPL Score", "Highest IPL Score", "highest_ipl_score");

    private final String displayName;
    private final List<String> candidates;

    LogicalField(String displayName, String... candidates) {
        this.displayName = displayName;
        this.candidates = List.of(candidates);
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
