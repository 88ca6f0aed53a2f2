package com.ai.hospital.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "scheduling")
public class SchedulingProperties {

    /** Zone used for "today" and "now"; blank means the JVM default. */
    private String zone = "";

    @Valid
    @NotNull
    private Store store = new Store();

    @Valid
    @NotNull
    private Catalog catalog = new Catalog();

    public enum StoreType { JPA, FILE }

    @Getter
    @Setter
    public static class Store {

        @NotNull
        private StoreType type = StoreType.JPA;

        /** JSON document location, used when type is FILE. */
        @NotBlank
        private String filePath = "data/appointments.json";

        @Min(1)
        private int maxCommitAttempts = 3;
    }

    @Getter
    @Setter
    public static class Catalog {

        @Valid
        private List<Department> departments = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Department {

        @NotBlank
        private String name;

        @Valid
        private List<Doctor> doctors = new ArrayList<>();
    }

    /**
     * A doctor on the roster. Leaving days, start and end all unset means the doctor
     * works the default hours.
     */
    @Getter
    @Setter
    public static class Doctor {

        @NotBlank
        private String name;

        /** 0 = Monday ... 6 = Sunday. */
        private List<Integer> days = new ArrayList<>();

        /** HH:MM, inclusive. */
        private String start;

        /** HH:MM, exclusive. */
        private String end;

        public boolean hasSchedule() {
            return !days.isEmpty() || start != null || end != null;
        }
    }
}
