package com.knotcore.service.scheduling;

import com.knotcore.model.entity.Milestone;
import com.knotcore.model.enums.MilestoneType;
import com.knotcore.model.enums.Recurrence;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.MonthDay;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Optional;

/**
 * Calendar rules for the next occurrence of a milestone.
 */
public final class MilestoneOccurrences {

    private MilestoneOccurrences() {
    }

    /**
     * Next occurrence on or after {@code today}.
     *
     * Yearly milestones repeat on the month and day of their stored date (the stored year is a
     * placeholder); Feb 29 falls on Feb 28 in non-leap years. Holidays named after Mother's Day or
     * Father's Day follow the 2nd Sunday of May and the 3rd Sunday of June.
     *
     * @param milestone Milestone
     * @param today Current date in the recipient's zone
     * @return Next occurrence, empty for a one-time milestone already in the past
     */
    public static Optional<LocalDate> next(Milestone milestone, LocalDate today) {
        if (milestone.getRecurrence() == Recurrence.ONE_TIME) {
            LocalDate date = milestone.getDate();
            return date.isBefore(today) ? Optional.empty() : Optional.of(date);
        }
        LocalDate thisYear = inYear(milestone, today.getYear());
        if (!thisYear.isBefore(today)) {
            return Optional.of(thisYear);
        }
        return Optional.of(inYear(milestone, today.getYear() + 1));
    }

    /**
     * Occurrence of a yearly milestone in the given year.
     */
    public static LocalDate inYear(Milestone milestone, int year) {
        if (milestone.getType() == MilestoneType.HOLIDAY && milestone.getName() != null) {
            String name = milestone.getName().toLowerCase(Locale.ROOT);
            if (name.contains("mother")) {
                return nthSunday(year, Month.MAY, 2);
            }
            if (name.contains("father")) {
                return nthSunday(year, Month.JUNE, 3);
            }
        }
        MonthDay monthDay = MonthDay.from(milestone.getDate());
        // atYear clamps Feb 29 to Feb 28 in non-leap years
        return monthDay.atYear(year);
    }

    private static LocalDate nthSunday(int year, Month month, int ordinal) {
        return LocalDate.of(year, month, 1)
                .with(TemporalAdjusters.dayOfWeekInMonth(ordinal, DayOfWeek.SUNDAY));
    }
}
