package com.streetsweeping.engine.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streetsweeping.engine.config.SweepingProperties;
import com.streetsweeping.engine.dto.ReminderPreference;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Reminder preferences, stored as one ordered list.
 */
@Repository
public class PreferenceRepository extends JsonDocumentRepository<PreferenceRepository.PreferenceList> {

    public PreferenceRepository(KeyValueStore store, ObjectMapper objectMapper, SweepingProperties properties) {
        super(store, objectMapper, properties.getStore().getKeyPrefix() + "preferences", PreferenceList.class);
    }

    @Override
    protected PreferenceList emptyDocument() {
        return new PreferenceList(null, List.of());
    }

    /**
     * @param seeded      set once the default preferences were written, so deleting them all
     *                    does not bring them back; null when never seeded
     * @param preferences preferences in creation order
     */
    public record PreferenceList(Boolean seeded, List<ReminderPreference> preferences) {

        public PreferenceList {
            preferences = preferences == null ? List.of() : List.copyOf(preferences);
        }

        public boolean wasSeeded() {
            return Boolean.TRUE.equals(seeded);
        }

        public PreferenceList with(List<ReminderPreference> updated) {
            return new PreferenceList(seeded, updated);
        }

        public PreferenceList append(ReminderPreference preference) {
            List<ReminderPreference> updated = new ArrayList<>(preferences);
            updated.add(preference);
            return new PreferenceList(seeded, updated);
        }
    }
}
