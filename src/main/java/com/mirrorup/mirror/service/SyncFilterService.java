package com.mirrorup.mirror.service;

import com.mirrorup.mirror.exclude.ExclusionRules;
import com.mirrorup.mirror.model.MirrorCatalog;
import com.mirrorup.mirror.model.MirrorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Keeps mirrors that are active, served over HTTP(S), fully synced and less than an hour behind,
 * minus any excluded by rule. Survivors are ordered by delay.
 */
@Service
public class SyncFilterService {
    private static final Logger log = LoggerFactory.getLogger(SyncFilterService.class);

    public static final long MAX_DELAY_SECONDS = 3600;
    static final double COMPLETION_EPSILON = 1e-9;

    public List<MirrorRecord> filter(MirrorCatalog catalog, int maxCheck, ExclusionRules rules) {
        List<MirrorRecord> source = catalog == null ? List.of() : catalog.urls();
        List<MirrorRecord> synced = new ArrayList<>();
        int excluded = 0;
        for (MirrorRecord mirror : source) {
            if (!isSynced(mirror)) {
                continue;
            }
            if (rules != null && rules.isExcluded(mirror)) {
                log.debug("Excluded mirror {} ({}, {})", mirror.url(), mirror.country(), mirror.countryCode());
                excluded++;
                continue;
            }
            synced.add(mirror);
        }

        synced.sort(Comparator.comparingLong(MirrorRecord::delay));
        List<MirrorRecord> result = maxCheck > 0 && synced.size() > maxCheck
            ? new ArrayList<>(synced.subList(0, maxCheck))
            : synced;

        log.info(
            "Sync filter: catalog={}, synced={}, excluded={}, candidates={}",
            source.size(),
            synced.size() + excluded,
            excluded,
            result.size()
        );
        if (result.isEmpty()) {
            throw new NoCandidatesException(
                "No best synced mirrors: none of " + source.size()
                    + " mirrors is active, http(s), fully synced, less than "
                    + MAX_DELAY_SECONDS + "s behind and not excluded"
            );
        }
        return result;
    }

    public static boolean isSynced(MirrorRecord mirror) {
        if (mirror == null || !mirror.active()) {
            return false;
        }
        String protocol = mirror.protocol() == null ? "" : mirror.protocol().toLowerCase(Locale.ROOT);
        if (!protocol.equals("http") && !protocol.equals("https")) {
            return false;
        }
        Double completion = mirror.completionPct();
        if (completion == null || Math.abs(completion - 1.0) >= COMPLETION_EPSILON) {
            return false;
        }
        Long delay = mirror.delay();
        return delay != null && delay < MAX_DELAY_SECONDS;
    }
}
