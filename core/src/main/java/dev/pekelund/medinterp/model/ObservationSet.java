package dev.pekelund.medinterp.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * The unit of data flowing from extraction through interpretation.
 */
public record ObservationSet(String panelName, List<Observation> observations) {

    private static final ObservationSet EMPTY = new ObservationSet(null, List.of());

    public ObservationSet {
        observations = observations == null ? List.of() : List.copyOf(observations);
    }

    public static ObservationSet empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return observations.isEmpty();
    }

    @JsonIgnore
    public int size() {
        return observations.size();
    }
}
