package com.semsql.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.semsql.model.Relation;
import com.semsql.model.SchemaCatalog;
import com.semsql.model.SchemaGraph;
import com.semsql.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the read-only {@link SchemaGraph} from a JSON catalogue. Every relation condition is
 * normalized once here, so a malformed catalogue fails at start-up rather than on a request.
 */
@Service
public class SchemaGraphLoader {
    private static final Logger logger = LoggerFactory.getLogger(SchemaGraphLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final JoinConditionNormalizer joinConditionNormalizer;

    @Autowired
    public SchemaGraphLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper,
                             JoinConditionNormalizer joinConditionNormalizer) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.joinConditionNormalizer = joinConditionNormalizer;
    }

    public SchemaGraph load(String location) {
        Resource resource = resourceLoader.getResource(location);
        logger.info("Loading schema catalogue from {}", location);
        try (InputStream input = resource.getInputStream()) {
            return build(objectMapper.readValue(input, SchemaCatalog.class));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema catalogue " + location + ": " + e.getMessage(), e);
        }
    }

    public SchemaGraph build(SchemaCatalog catalog) {
        SchemaGraph.Builder builder = SchemaGraph.builder();
        for (SchemaCatalog.TableEntry table : catalog.getTables()) {
            builder.table(table.getName(), table.getAlias(), table.getPrimaryKey(), table.getColumns());
        }
        for (SchemaCatalog.RelationEntry relation : catalog.getRelations()) {
            builder.relation(relation.getName(), relation.getLeft(), relation.getRight(),
                relation.getCondition(), relation.getCardinality());
        }
        SchemaGraph graph = builder.build();

        for (Relation relation : graph.getRelations()) {
            logger.debug("Relation {} joins on {}", relation.getName(), joinConditionNormalizer.parse(relation, graph));
        }
        logger.info("Built schema graph with {} tables and {} relations", graph.size(), graph.getRelations().size());
        return graph;
    }

    /**
     * Catalogue view of a built graph, with the assigned aliases filled in.
     */
    public SchemaCatalog describe(SchemaGraph graph) {
        SchemaCatalog catalog = new SchemaCatalog();
        List<SchemaCatalog.TableEntry> tables = new ArrayList<>();
        for (Table table : graph.getTables()) {
            tables.add(new SchemaCatalog.TableEntry(table.getName(), table.getAlias(), table.getPrimaryKey(),
                table.getColumns()));
        }
        List<SchemaCatalog.RelationEntry> relations = new ArrayList<>();
        for (Relation relation : graph.getRelations()) {
            relations.add(new SchemaCatalog.RelationEntry(relation.getName(), relation.getLeft(), relation.getRight(),
                joinConditionNormalizer.normalize(relation.getCondition(), relation.getLeft(), relation.getRight(), graph),
                relation.getCardinality()));
        }
        catalog.setTables(tables);
        catalog.setRelations(relations);
        return catalog;
    }
}
