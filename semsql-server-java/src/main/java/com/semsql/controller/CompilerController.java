package com.semsql.controller;

import com.semsql.exception.InvalidIntentException;
import com.semsql.exception.SemanticCompilationException;
import com.semsql.model.CompilationResult;
import com.semsql.model.CompileRequest;
import com.semsql.model.CompileResponse;
import com.semsql.model.SchemaCatalog;
import com.semsql.model.SchemaGraph;
import com.semsql.model.SemanticQueryIntent;
import com.semsql.service.SchemaGraphLoader;
import com.semsql.service.SemanticIntentMapper;
import com.semsql.service.SemanticQueryCompiler;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class CompilerController {
    private static final Logger logger = LoggerFactory.getLogger(CompilerController.class);

    private final SemanticQueryCompiler compiler;
    private final SemanticIntentMapper intentMapper;
    private final SchemaGraphLoader schemaGraphLoader;
    private final SchemaGraph schemaGraph;

    @Autowired
    public CompilerController(SemanticQueryCompiler compiler, SemanticIntentMapper intentMapper,
                              SchemaGraphLoader schemaGraphLoader, SchemaGraph schemaGraph) {
        this.compiler = compiler;
        this.intentMapper = intentMapper;
        this.schemaGraphLoader = schemaGraphLoader;
        this.schemaGraph = schemaGraph;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
            "message", "Semantic SQL Compiler",
            "version", "1.0.0",
            "status", "running"
        ));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        return ResponseEntity.ok(Map.of(
            "status", "healthy",
            "tables_count", schemaGraph.size(),
            "relations_count", schemaGraph.getRelations().size()
        ));
    }

    @GetMapping("/schema")
    public ResponseEntity<SchemaCatalog> schema() {
        return ResponseEntity.ok(schemaGraphLoader.describe(schemaGraph));
    }

    @PostMapping("/compile")
    public ResponseEntity<?> compile(@Valid @RequestBody CompileRequest request) {
        try {
            SemanticQueryIntent intent = intentMapper.toIntent(request);
            logger.info("Incoming compile request: {}", intent);
            CompilationResult result = compiler.compile(intent, schemaGraph);
            return ResponseEntity.ok(CompileResponse.of(result));
        } catch (InvalidIntentException e) {
            logger.warn("/api/compile rejected intent: {}", e.getMessage());
            return ResponseEntity.badRequest().body(errorBody(e));
        } catch (SemanticCompilationException e) {
            logger.warn("/api/compile failed with {}: {}", e.getErrorCode(), e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(errorBody(e));
        }
    }

    private Map<String, Object> errorBody(SemanticCompilationException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getErrorCode());
        body.put("message", e.getMessage());
        body.put("details", e.getDetails());
        return body;
    }
}
