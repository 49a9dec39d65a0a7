package me.golemcore.toolloop;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class ToolLoopApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(ToolLoopApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(ToolLoopApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(ToolLoopApplication.class.getMethod("main", String[].class));
    }
}
