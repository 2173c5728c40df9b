package com.dadtutor.progress;

import com.dadtutor.progress.ProgressModels.PracticeSession;
import com.dadtutor.progress.ProgressModels.ProgressSnapshot;
import com.dadtutor.progress.ProgressModels.StreakPolicy;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Summarizes a practice history, oldest session first, into dashboard metrics.
 */
public class ProgressAnalytics {
    private final Clock clock;
    private final ZoneId zone;
    private final StreakPolicy streakPolicy;
    private final int recentLimit;

    public ProgressAnalytics(Clock clock, ZoneId zone, StreakPolicy streakPolicy, int recentLimit) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.streakPolicy = Objects.requireNonNull(streakPolicy, "streakPolicy");
        this.recentLimit = Math.max(recentLimit, 0);
    }

    public ProgressSnapshot summarize(List<PracticeSession> sessions, long questionsMastered, long questionsAttempted) {
        List<PracticeSession> history = sessions == null ? List.of() : sessions.stream().filter(Objects::nonNull).toList();
        return new ProgressSnapshot(
                masteryRate(questionsMastered, questionsAttempted),
                history.size(),
                recentSessions(history),
                streak(history)
        );
    }

    static int masteryRate(long mastered, long attempted) {
        if (attempted <= 0) return 0;
        return (int) Math.round(100.0 * mastered / attempted);
    }

    List<PracticeSession> recentSessions(List<PracticeSession> history) {
        int from = Math.max(history.size() - recentLimit, 0);
        List<PracticeSession> recent = new ArrayList<>(history.subList(from, history.size()));
        Collections.reverse(recent);
        return List.copyOf(recent);
    }

    int streak(List<PracticeSession> history) {
        List<LocalDate> days = practiceDays(history);
        if (days.isEmpty()) return 0;

        LocalDate today = LocalDate.ofInstant(clock.instant(), zone);
        LocalDate last = days.get(days.size() - 1);
        if (!last.equals(today) && !last.equals(today.minusDays(1))) return 0;

        int streak = 1;
        for (int i = days.size() - 2; i >= 0; i--) {
            if (!days.get(i).equals(days.get(i + 1).minusDays(1))) break;
            streak++;
        }
        return streak;
    }

    private List<LocalDate> practiceDays(List<PracticeSession> history) {
        List<LocalDate> days = history.stream()
                .map(PracticeSession::sessionDate)
                .filter(Objects::nonNull)
                .map(ts -> LocalDate.ofInstant(ts, zone))
                .toList();
        if (streakPolicy == StreakPolicy.DEDUPE_BY_DAY) {
            return List.copyOf(new TreeSet<>(days));
        }
        return days;
    }
}
