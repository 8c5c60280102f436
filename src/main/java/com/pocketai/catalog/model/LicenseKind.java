package com.pocketai.catalog.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Closed license vocabulary of the local catalog. Each kind carries the token
 * used by Hugging Face model cards, which is also the value stored in the
 * database.
 */
public enum LicenseKind {

    // permissive
    APACHE_2_0("apache-2.0"),
    MIT("mit"),
    BSD("bsd"),
    BSD_3_CLAUSE("bsd-3-clause"),
    BSD_3_CLAUSE_CLEAR("bsd-3-clause-clear"),
    CC0_1_0("cc0-1.0"),
    AFL_3_0("afl-3.0"),

    // attribution or use restrictions
    CC_BY_4_0("cc-by-4.0"),
    CC_BY_SA_3_0("cc-by-sa-3.0"),
    CC_BY_SA_4_0("cc-by-sa-4.0"),
    OPENRAIL("openrail"),
    OPENRAIL_M("openrail++"),

    // non-commercial or copyleft
    CC_BY_NC_4_0("cc-by-nc-4.0"),
    CC_BY_NC_SA_4_0("cc-by-nc-sa-4.0"),
    CC_BY_NC_ND_4_0("cc-by-nc-nd-4.0"),
    GPL_3_0("gpl-3.0"),
    AGPL_3_0("agpl-3.0"),
    LLAMA_2("llama2"),
    LLAMA_3("llama3"),

    OTHER("other"),
    UNKNOWN("unknown");

    private static final Set<LicenseKind> COMMERCIAL_USE = EnumSet.of(
            APACHE_2_0, MIT, BSD, BSD_3_CLAUSE, BSD_3_CLAUSE_CLEAR, CC0_1_0, AFL_3_0,
            CC_BY_4_0, OPENRAIL, OPENRAIL_M);

    private final String token;

    LicenseKind(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * Heuristic only: whether the license family generally permits commercial
     * use. Not legal advice.
     */
    public boolean isCommercialUseAllowed() {
        return COMMERCIAL_USE.contains(this);
    }

    /**
     * Look up a kind by its token, ignoring case and surrounding whitespace.
     *
     * @return the matching kind, or {@code null} when the token is unknown
     */
    public static LicenseKind fromToken(String token) {
        if (token == null) {
            return null;
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (LicenseKind kind : values()) {
            if (kind.token.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
