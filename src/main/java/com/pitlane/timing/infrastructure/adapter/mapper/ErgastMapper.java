package com.pitlane.timing.infrastructure.adapter.mapper;

import com.pitlane.timing.domain.model.DriverEntry;
import com.pitlane.timing.domain.model.Event;
import com.pitlane.timing.domain.model.SessionId;
import com.pitlane.timing.domain.model.SessionResult;
import com.pitlane.timing.infrastructure.adapter.origin.json.ConstructorJson;
import com.pitlane.timing.infrastructure.adapter.origin.json.DriverJson;
import com.pitlane.timing.infrastructure.adapter.origin.json.QualifyingResultJson;
import com.pitlane.timing.infrastructure.adapter.origin.json.RaceJson;
import com.pitlane.timing.infrastructure.adapter.origin.json.ResultJson;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Shapes Ergast responses into schedule events and tabular session results.
 */
@Component
public class ErgastMapper {

    private static final Logger logger = LoggerFactory.getLogger(ErgastMapper.class);

    public static final List<String> RACE_COLUMNS = List.of("Pos", "Driver", "Team", "Time", "Laps", "Points");
    public static final List<String> QUALIFYING_COLUMNS = List.of("Pos", "Driver", "Team", "Best Time");

    public List<Event> mapSchedule(int year, List<RaceJson> races) {
        return races.stream()
                .map(race -> mapToEvent(year, race))
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingInt(Event::roundNumber))
                .toList();
    }

    /**
     * Race and sprint classifications
     */
    public Optional<SessionResult> mapClassification(SessionId id, String sessionName, List<ResultJson> results) {
        if (results == null || results.isEmpty()) {
            return Optional.empty();
        }

        List<List<Object>> rows = new ArrayList<>();
        List<DriverEntry> drivers = new ArrayList<>();
        for (ResultJson result : results) {
            String code = driverCode(result.driver());
            rows.add(Arrays.asList(
                    parseInt(result.position()),
                    code,
                    teamName(result.constructor()),
                    result.time() != null && result.time().time() != null ? result.time().time() : result.status(),
                    parseInt(result.laps()),
                    parseDouble(result.points())));
            drivers.add(new DriverEntry(displayName(result.driver()), code));
        }

        return Optional.of(SessionResult.of(id, sessionName, "race", rows, drivers, RACE_COLUMNS));
    }

    public Optional<SessionResult> mapQualifying(SessionId id, List<QualifyingResultJson> results) {
        if (results == null || results.isEmpty()) {
            return Optional.empty();
        }

        List<List<Object>> rows = new ArrayList<>();
        List<DriverEntry> drivers = new ArrayList<>();
        for (QualifyingResultJson result : results) {
            String code = driverCode(result.driver());
            rows.add(Arrays.asList(
                    parseInt(result.position()),
                    code,
                    teamName(result.constructor()),
                    bestQualifyingTime(result)));
            drivers.add(new DriverEntry(displayName(result.driver()), code));
        }

        return Optional.of(SessionResult.of(id, "Qualifying", "qualifying", rows, drivers, QUALIFYING_COLUMNS));
    }

    private Event mapToEvent(int year, RaceJson race) {
        try {
            RaceJson.LocationJson location = race.circuit() != null ? race.circuit().location() : null;
            return Event.of(
                    year,
                    Integer.parseInt(race.round()),
                    race.raceName(),
                    race.date() != null ? LocalDate.parse(race.date()) : null,
                    location != null ? location.country() : null,
                    location != null ? location.locality() : null);
        } catch (RuntimeException e) {
            logger.warn("Failed to map round {} of {}: {}", race.round(), year, e.getMessage());
            return null;
        }
    }

    // Q3 beats Q2 beats Q1: later segments are the faster laps of the drivers still running
    private static String bestQualifyingTime(QualifyingResultJson result) {
        if (hasText(result.q3())) {
            return result.q3();
        }
        if (hasText(result.q2())) {
            return result.q2();
        }
        return hasText(result.q1()) ? result.q1() : null;
    }

    private static String driverCode(DriverJson driver) {
        if (driver == null) {
            return null;
        }
        if (hasText(driver.code())) {
            return driver.code();
        }
        return driver.driverId();
    }

    private static String displayName(DriverJson driver) {
        if (driver == null) {
            return null;
        }
        String name = ((driver.givenName() != null ? driver.givenName() : "") + " "
                + (driver.familyName() != null ? driver.familyName() : "")).trim();
        return name.isEmpty() ? driverCode(driver) : name;
    }

    private static String teamName(ConstructorJson constructor) {
        return constructor != null ? constructor.name() : null;
    }

    private static Integer parseInt(String value) {
        try {
            return hasText(value) ? Integer.valueOf(value) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble(String value) {
        try {
            return hasText(value) ? Double.valueOf(value) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
