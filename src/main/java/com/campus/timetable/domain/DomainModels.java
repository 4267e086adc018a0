package com.campus.timetable.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.util.List;

public class DomainModels {
    public record Course(String id, String title, int credits, Difficulty difficulty, List<Section> sections) {
        public Course {
            sections = sections == null ? List.of() : sections;
        }
    }

    public record Section(String id, String professor, DeliveryFormat format, int seatsAvailable, List<TimeSlot> timeSlots) {
        public Section {
            timeSlots = timeSlots == null ? List.of() : timeSlots;
        }
    }

    /** One weekly meeting; times are same-day wall-clock {@code HH:MM}. */
    public record TimeSlot(DayOfWeek day, String startTime, String endTime) {
        @Override
        public String toString() {
            return day + " " + startTime + "-" + endTime;
        }
    }

    public record ScheduleConstraints(List<DayOfWeek> preferredDays,
                                      List<String> avoidProfessors,
                                      List<String> preferredTimeSlots,
                                      Double budget,
                                      Double availableTime) {
        public ScheduleConstraints {
            preferredDays = preferredDays == null ? List.of() : preferredDays;
            avoidProfessors = avoidProfessors == null ? List.of() : avoidProfessors;
            preferredTimeSlots = preferredTimeSlots == null ? List.of() : preferredTimeSlots;
        }

        public static ScheduleConstraints none() {
            return new ScheduleConstraints(List.of(), List.of(), List.of(), null, null);
        }

        public ScheduleConstraints withPreferredTimeSlots(List<String> windows) {
            return new ScheduleConstraints(preferredDays, avoidProfessors, windows, budget, availableTime);
        }
    }

    public enum Difficulty {
        @JsonProperty("beginner") BEGINNER(1, 0.8),
        @JsonProperty("intermediate") INTERMEDIATE(2, 1.0),
        @JsonProperty("advanced") ADVANCED(3, 1.3),
        @JsonProperty("expert") EXPERT(4, 1.5);

        private final int rank;
        private final double workloadMultiplier;

        Difficulty(int rank, double workloadMultiplier) {
            this.rank = rank;
            this.workloadMultiplier = workloadMultiplier;
        }

        public int rank() {
            return rank;
        }

        public double workloadMultiplier() {
            return workloadMultiplier;
        }
    }

    public enum DeliveryFormat {
        @JsonProperty("in-person") IN_PERSON,
        @JsonProperty("hybrid") HYBRID,
        @JsonProperty("online") ONLINE
    }
}
