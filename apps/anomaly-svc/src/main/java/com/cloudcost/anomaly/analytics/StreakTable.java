package com.cloudcost.anomaly.analytics;

import com.cloudcost.anomaly.model.Anomaly;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collapses an anomaly that is re-detected on consecutive scan days into one event, keeping the
 * most extreme day. Owned by a single scan call; not thread-safe.
 */
final class StreakTable {

    private final Map<Anomaly.StreakKey, Streak> active = new LinkedHashMap<>();
    private final List<Anomaly> finished = new ArrayList<>();

    /**
     * Records every detection for {@code day}, then closes streaks that were not re-detected.
     */
    void advance(LocalDate day, List<Anomaly> detections) {
        Set<Anomaly.StreakKey> seenToday = new HashSet<>();
        for (Anomaly anomaly : detections) {
            Anomaly.StreakKey key = anomaly.streakKey();
            seenToday.add(key);
            Streak streak = active.get(key);
            if (streak == null) {
                active.put(key, new Streak(anomaly, day));
            } else {
                Anomaly best = Math.abs(anomaly.zScore()) > Math.abs(streak.best().zScore())
                        ? anomaly
                        : streak.best();
                active.put(key, new Streak(best, day));
            }
        }
        Iterator<Map.Entry<Anomaly.StreakKey, Streak>> iterator = active.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<Anomaly.StreakKey, Streak> entry = iterator.next();
            if (!seenToday.contains(entry.getKey())) {
                finished.add(entry.getValue().best());
                iterator.remove();
            }
        }
    }

    int activeCount() {
        return active.size();
    }

    Optional<LocalDate> lastSeen(Anomaly.StreakKey key) {
        return Optional.ofNullable(active.get(key)).map(Streak::lastSeen);
    }

    /**
     * Closes all open streaks and returns every collapsed event, unsorted.
     */
    List<Anomaly> flush() {
        active.values().forEach(streak -> finished.add(streak.best()));
        active.clear();
        return finished;
    }

    private record Streak(Anomaly best, LocalDate lastSeen) {
    }
}
