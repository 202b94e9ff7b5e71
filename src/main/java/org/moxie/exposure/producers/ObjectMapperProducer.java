package org.moxie.exposure.producers;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

@ApplicationScoped
public class ObjectMapperProducer {

    @Produces
    @Singleton
    public ObjectMapper produceObjectMapper() {
        return JsonMapper.builder()
                         .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                         .configure(MapperFeature.ALLOW_COERCION_OF_SCALARS, false)
                         .addModule(new Jdk8Module())
                         .build();
    }
}
