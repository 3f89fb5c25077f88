package com.vidnyan.semtree.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.semtree.adapter.out.parser.JacksonJsonCstParser;
import com.vidnyan.semtree.adapter.out.parser.JavaParserCstParser;
import com.vidnyan.semtree.adapter.out.parser.SnakeYamlCstParser;
import com.vidnyan.semtree.adapter.out.query.XPathQueryEngine;
import com.vidnyan.semtree.adapter.out.rules.ClasspathRuleTableRepository;
import com.vidnyan.semtree.adapter.out.rules.classifier.CSharpLanguageCallbacks;
import com.vidnyan.semtree.adapter.out.rules.classifier.DefaultLanguageCallbacks;
import com.vidnyan.semtree.application.service.SemanticTreeService;
import com.vidnyan.semtree.application.service.TreeQueryService;
import com.vidnyan.semtree.config.SemtreeProperties;
import com.vidnyan.semtree.domain.build.DocumentAssembler;
import com.vidnyan.semtree.domain.model.NameTable;
import com.vidnyan.semtree.scanner.RepositoryScanner;

import java.util.List;

/**
 * The application wired by hand with the bundled rule tables and parsers.
 */
public final class TestEngine {

    public final NameTable names = new NameTable();
    public final SemtreeProperties properties = new SemtreeProperties();
    public final ClasspathRuleTableRepository rules;
    public final SemanticTreeService builder;
    public final XPathQueryEngine queryEngine = new XPathQueryEngine();
    public final TreeQueryService queries;

    public TestEngine() {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        rules = new ClasspathRuleTableRepository(mapper,
                List.of(new DefaultLanguageCallbacks(), new CSharpLanguageCallbacks()), names);
        rules.loadTables();
        properties.setConcurrency(2);
        builder = new SemanticTreeService(rules,
                List.of(new JavaParserCstParser(), new JacksonJsonCstParser(), new SnakeYamlCstParser()),
                new DocumentAssembler(names), properties);
        queries = new TreeQueryService(builder, queryEngine, new RepositoryScanner(), properties);
    }
}
