package com.gt.studyscheduler.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.studyscheduler.model.PracticeFrequency;

import java.io.IOException;

public class PracticeFrequencySerializer extends JsonSerializer<PracticeFrequency> {
    @Override
    public void serialize(PracticeFrequency practiceFrequency, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(practiceFrequency.getWireName());
    }
}
