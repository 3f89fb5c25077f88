package com.vidnyan.semtree.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.semtree.adapter.out.rules.classifier.LanguageCallbacks;
import com.vidnyan.semtree.application.port.out.CstParser;
import com.vidnyan.semtree.domain.build.DocumentAssembler;
import com.vidnyan.semtree.domain.model.NameTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for the tree construction engine.
 * Wires the framework-free domain classes into the application.
 */
@Slf4j
@Configuration
public class SemtreeConfiguration {

    /**
     * ObjectMapper for rule tables and REST payloads.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Element and attribute names shared by every arena; filled while rule tables load.
     */
    @Bean
    public NameTable nameTable() {
        return new NameTable();
    }

    @Bean
    public DocumentAssembler documentAssembler(NameTable nameTable) {
        return new DocumentAssembler(nameTable);
    }

    /**
     * Log available parsers and classifier callbacks on startup.
     */
    @Bean
    public String logParsers(List<CstParser> parsers, List<LanguageCallbacks> callbacks) {
        log.info("Registered {} CST parsers:", parsers.size());
        parsers.forEach(p -> log.info("  - {}", p.getName()));
        log.info("Registered {} classifier callbacks:", callbacks.size());
        callbacks.forEach(c -> log.info("  - {}", c.getName()));
        return "parsers-logged";
    }
}
