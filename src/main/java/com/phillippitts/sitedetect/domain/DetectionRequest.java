package com.phillippitts.sitedetect.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Caller-supplied detection request. Immutable for the lifetime of the request.
 *
 * <p>Normalization performed by the compact constructor:
 * <ul>
 *   <li>capabilities are de-duplicated; a missing or empty set defaults to damage + material</li>
 *   <li>a missing priority defaults to {@link Priority#NORMAL}</li>
 *   <li>the photo URL is trimmed</li>
 * </ul>
 *
 * @param photoId identifier of the photo in the photo store
 * @param photoUrl retrievable reference to the photo; forwarded to engines, never fetched here
 * @param capabilities requested capabilities
 * @param priority request priority
 * @param metadata free-form caller metadata, passed through to engines
 */
public record DetectionRequest(
        @JsonProperty("photo_id") @NotNull UUID photoId,
        @JsonProperty("photo_url") @NotBlank String photoUrl,
        @JsonProperty("capabilities") Set<Capability> capabilities,
        @JsonProperty("priority") Priority priority,
        @JsonProperty("metadata") Map<String, Object> metadata
) {

    /** Capabilities used when the caller does not name any. */
    public static final Set<Capability> DEFAULT_CAPABILITIES =
            Collections.unmodifiableSet(EnumSet.of(Capability.DAMAGE, Capability.MATERIAL));

    public DetectionRequest {
        photoUrl = photoUrl == null ? null : photoUrl.trim();
        capabilities = normalize(capabilities);
        priority = priority == null ? Priority.NORMAL : priority;
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Convenience factory with normal priority and no metadata; repeated capabilities collapse. */
    public static DetectionRequest of(UUID photoId, String photoUrl, Capability... capabilities) {
        Set<Capability> requested = capabilities == null ? null : new HashSet<>(Arrays.asList(capabilities));
        return new DetectionRequest(photoId, photoUrl, requested, Priority.NORMAL, Map.of());
    }

    private static Set<Capability> normalize(Collection<Capability> requested) {
        if (requested == null || requested.isEmpty()) {
            return DEFAULT_CAPABILITIES;
        }
        EnumSet<Capability> set = EnumSet.noneOf(Capability.class);
        for (Capability c : requested) {
            if (c != null) {
                set.add(c);
            }
        }
        return set.isEmpty() ? DEFAULT_CAPABILITIES : Collections.unmodifiableSet(set);
    }
}
