package com.pocketai.catalog.service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import com.pocketai.catalog.hub.HubModelDescriptor;
import com.pocketai.catalog.model.LicenseKind;

/**
 * Translates hub metadata into the catalog's closed vocabulary. Pure
 * functions; no state and no I/O.
 */
public final class ModelFieldMapper {

    static final String DESCRIPTION_FALLBACK = "Model synced from Hugging Face: ";

    private ModelFieldMapper() {
    }

    public static LicenseKind mapLicense(String rawLicenseLabel) {
        LicenseKind kind = LicenseKind.fromToken(rawLicenseLabel);
        return kind == null ? LicenseKind.UNKNOWN : kind;
    }

    public static Set<String> mapTags(Collection<String> rawTags) {
        if (rawTags == null || rawTags.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> tags = new LinkedHashSet<>();
        for (String raw : rawTags) {
            if (raw == null) {
                continue;
            }
            String tag = raw.trim().toLowerCase(Locale.ROOT);
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return Collections.unmodifiableSet(tags);
    }

    public static String mapTask(String rawTask) {
        if (rawTask == null || rawTask.isBlank()) {
            return null;
        }
        return rawTask.trim();
    }

    public static String mapDescription(String rawDescription, String externalId) {
        if (rawDescription == null || rawDescription.isBlank()) {
            return DESCRIPTION_FALLBACK + externalId;
        }
        return rawDescription.trim();
    }

    /**
     * The display name, or the last path segment of the external id when the
     * descriptor has none.
     */
    public static String displayNameFor(HubModelDescriptor descriptor) {
        String name = descriptor.getDisplayName();
        if (name != null && !name.isBlank()) {
            return name.trim();
        }
        String id = descriptor.getExternalId().trim();
        int slash = id.lastIndexOf('/');
        return slash >= 0 ? id.substring(slash + 1) : id;
    }

    public static String originUrl(HubModelDescriptor descriptor, String hubBaseUrl) {
        String url = descriptor.getUrl();
        if (url != null && !url.isBlank()) {
            return url.trim();
        }
        return hubBaseUrl + "/" + descriptor.getExternalId().trim();
    }

    /**
     * Derive the catalog slug from the external id ("Org/Model_v2" becomes
     * "org-model_v2"), falling back to the display name when the id is blank.
     * The same inputs always give the same slug.
     *
     * @throws ItemMappingException when neither input yields a usable slug
     */
    public static String deriveSlug(String displayName, String externalId) {
        String source = externalId != null && !externalId.isBlank() ? externalId : displayName;
        String slug = slugify(source);
        if (slug.isEmpty()) {
            throw new ItemMappingException("Cannot derive a slug from id '" + externalId + "' / name '" + displayName + "'");
        }
        return slug;
    }

    private static String slugify(String source) {
        if (source == null) {
            return "";
        }
        String lowered = source.trim().toLowerCase(Locale.ROOT).replace('/', '-');
        StringBuilder sb = new StringBuilder(lowered.length());
        for (int i = 0; i < lowered.length(); i++) {
            char c = lowered.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '.' || c == '_' || c == '-';
            sb.append(allowed ? c : '-');
        }
        String slug = sb.toString();
        // nothing but separators left
        if (slug.chars().allMatch(c -> c == '-' || c == '.' || c == '_')) {
            return "";
        }
        return slug;
    }
}
