package com.streetsweeping.engine.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streetsweeping.engine.config.SweepingProperties;
import com.streetsweeping.engine.dto.ReminderSet;
import org.springframework.stereotype.Repository;

/**
 * The persisted reminder set: tracked locations and their pending reminders.
 */
@Repository
public class ReminderSetRepository extends JsonDocumentRepository<ReminderSet> {

    public ReminderSetRepository(KeyValueStore store, ObjectMapper objectMapper, SweepingProperties properties) {
        super(store, objectMapper, properties.getStore().getKeyPrefix() + "reminder-set", ReminderSet.class);
    }

    @Override
    protected ReminderSet emptyDocument() {
        return ReminderSet.empty();
    }
}
