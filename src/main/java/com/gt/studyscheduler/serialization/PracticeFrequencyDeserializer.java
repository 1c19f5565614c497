package com.gt.studyscheduler.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.studyscheduler.model.PracticeFrequency;

import java.io.IOException;

public class PracticeFrequencyDeserializer extends JsonDeserializer<PracticeFrequency> {
    @Override
    public PracticeFrequency deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        String wireName = jsonParser.getValueAsString();
        PracticeFrequency practiceFrequency = PracticeFrequency.fromWireName(wireName);

        if (practiceFrequency == null) {
            return (PracticeFrequency) deserializationContext.handleWeirdStringValue(PracticeFrequency.class, wireName,
                    "Unknown practice frequency");
        }

        return practiceFrequency;
    }
}
