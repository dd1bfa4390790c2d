package com.property.linkage.index;

import com.property.linkage.core.model.CanonicalPropertyRecord;
import com.property.linkage.core.model.MatchResult;
import com.property.linkage.core.model.MatchStrategy;
import com.property.linkage.core.model.SecondaryRecord;
import com.property.linkage.rules.KeyNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Resolves one secondary record against a {@link CanonicalIndex}, trying strategies in strict
 * order and stopping at the first one that yields candidates:
 * <ol>
 *   <li>{@link MatchStrategy#STRUCTURED_ID}: exact normalized parcel identifier; then, for a
 *       suffixed identifier, its parent parcel; for an unsuffixed one, the sub-parcels under it</li>
 *   <li>{@link MatchStrategy#ADDRESS_CITY}: exact {@code ADDRESS|CITY} key</li>
 *   <li>{@link MatchStrategy#ADDRESS_ONLY}: normalized address against the address component of
 *       every key, ignoring city. May match same-numbered addresses in different towns.</li>
 * </ol>
 * Only reads the index, so it is safe to call from several threads at once.
 */
public class MatchCascadeResolver {
    private static final Logger log = LoggerFactory.getLogger(MatchCascadeResolver.class);

    public MatchResult resolve(SecondaryRecord record, CanonicalIndex index) {
        List<CanonicalPropertyRecord> candidates = resolveByStructuredId(record, index);
        if (!candidates.isEmpty()) {
            return MatchResult.of(MatchStrategy.STRUCTURED_ID, candidates);
        }

        String key = KeyNormalizer.makeAddressCityKey(record.getAddress(), record.getCity());
        if (key.isEmpty()) {
            return MatchResult.noMatch();
        }

        if (KeyNormalizer.hasCityComponent(key)) {
            candidates = index.findByAddressCityKey(key);
            if (!candidates.isEmpty()) {
                return MatchResult.of(MatchStrategy.ADDRESS_CITY, candidates);
            }
        }

        candidates = index.findByAddress(KeyNormalizer.addressComponent(key));
        if (!candidates.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("match.addressOnly line={} address='{}' candidates={}",
                        record.getLineNumber(), record.getAddress(), candidates.size());
            }
            return MatchResult.of(MatchStrategy.ADDRESS_ONLY, candidates);
        }
        return MatchResult.noMatch();
    }

    private List<CanonicalPropertyRecord> resolveByStructuredId(SecondaryRecord record, CanonicalIndex index) {
        String id = KeyNormalizer.normalizeStructuredId(record.getStructuredId());
        if (id.isEmpty()) {
            return List.of();
        }
        List<CanonicalPropertyRecord> candidates = index.findByStructuredId(id);
        if (!candidates.isEmpty()) {
            return candidates;
        }

        String baseId = KeyNormalizer.baseStructuredId(id);
        if (baseId.isEmpty()) {
            return List.of();
        }
        if (!baseId.equals(id)) {
            // a suffixed id may fall back to its parent parcel, never to a sibling sub-parcel
            return index.findByStructuredId(baseId);
        }
        return index.findByBaseStructuredId(baseId);
    }
}
