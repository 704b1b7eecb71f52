package io.rowguard.sql.commons;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static io.rowguard.sql.commons.ExpressionConstants.*;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionFactoryTest {

    @Test
    public void testReferenceAndConstant() {
        var ref = ExpressionFactory.reference("members", "user_id");
        assertArrayEquals(new String[]{"members", "user_id"}, Transformations.getReferenceName(ref));
        var constant = ExpressionFactory.constant(42L);
        assertTrue(Transformations.IS_CONSTANT.apply(constant));
        assertEquals(TYPE_BIGINT, constant.get(FIELD_VALUE).get(FIELD_TYPE).get(FIELD_ID).asText());
        assertTrue(ExpressionFactory.constant(null).get(FIELD_VALUE).get(FIELD_IS_NULL).asBoolean());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> ExpressionFactory.reference());
        assertThrows(IllegalArgumentException.class, () -> ExpressionFactory.equalExpr(null, ExpressionFactory.constant(1)));
        assertThrows(IllegalArgumentException.class, () -> ExpressionFactory.inStaticList(ExpressionFactory.reference("a"), List.of()));
        assertThrows(IllegalArgumentException.class, () -> ExpressionFactory.andFilters(new JsonNode[0]));
        assertThrows(IllegalArgumentException.class, () -> ExpressionFactory.constant(new Object()));
    }

    @Test
    public void testOrOfSingleChild() {
        var child = ExpressionFactory.reference("is_public");
        assertSame(child, ExpressionFactory.orFilters(new JsonNode[]{child}));
    }

    @Test
    public void testFunctionAndOperatorShape() {
        var uid = ExpressionFactory.function("auth", "uid");
        assertTrue(Transformations.isFunction("auth", "uid").apply(uid));
        assertEquals(0, uid.get(FIELD_CHILDREN).size());
        var minus = ExpressionFactory.binaryOperator("-", ExpressionFactory.function("", "now"),
                ExpressionFactory.function("", "to_days", ExpressionFactory.constant(1)));
        assertTrue(minus.get(FIELD_IS_OPERATOR).asBoolean());
        assertEquals("-", minus.get(FIELD_FUNCTION_NAME).asText());
    }

    @Test
    public void testFunctionMatchesParsedCall() throws JsonProcessingException {
        var parsed = Transformations.collectFunction(Transformations.compileFilterString("auth.uid() = owner_id"), "uid").get(0);
        var built = ExpressionFactory.function("auth", "uid");
        assertEquals("auth", parsed.get(FIELD_SCHEMA).asText());
        assertEquals(parsed.get(FIELD_SCHEMA), built.get(FIELD_SCHEMA));
        assertEquals(parsed.get(FIELD_CATALOG), built.get(FIELD_CATALOG));
        assertFalse(built.has(FIELD_SCHEMA_NAME));
        var tree = Transformations.parseToTree("select 1 from ef_items");
        ((ObjectNode) Transformations.getFirstStatementNode(tree)).set(FIELD_WHERE_CLAUSE,
                ExpressionFactory.equalExpr(ExpressionFactory.reference("owner"), built));
        assertTrue(Transformations.parseToSql(tree).contains("auth.uid()"));
    }

    @Test
    public void testBuiltFilterRunsInDuckDB()throws JsonProcessingException, SQLException {
        ConnectionPool.execute("create or replace table ef_items(id int, owner varchar, is_public boolean)");
        ConnectionPool.execute("insert into ef_items values (1, 'a', false), (2, 'b', true), (3, 'b', false), (4, null, false)");
        var filter = ExpressionFactory.orFilters(
                ExpressionFactory.equalExpr(ExpressionFactory.reference("owner"), ExpressionFactory.constant("a")),
                ExpressionFactory.equalExpr(ExpressionFactory.reference("is_public"), ExpressionFactory.trueExpression()));
        var tree = Transformations.parseToTree("select id from ef_items order by id");
        ((ObjectNode) Transformations.getFirstStatementNode(tree)).set(FIELD_WHERE_CLAUSE, filter);
        try (var connection = ConnectionPool.getConnection()) {
            var ids = ConnectionPool.collectFirstColumn(connection, Transformations.parseToSql(tree), Integer.class);
            assertEquals(List.of(1, 2), ids);
        }
    }

    @Test
    public void testInSubqueryShape() {
        var membership = ExpressionFactory.selectNode("members", ExpressionFactory.reference("team_id"),
                ExpressionFactory.equalExpr(ExpressionFactory.reference("user_id"), ExpressionFactory.function("auth", "uid")));
        var filter = ExpressionFactory.inSubquery(ExpressionFactory.reference("team_id"), membership);
        assertTrue(Transformations.IS_SUBQUERY.apply(filter));
        assertEquals(SUBQUERY_TYPE_ANY, filter.get(FIELD_SUBQUERY_TYPE).asText());
        assertEquals(COMPARE_TYPE_EQUAL, filter.get(FIELD_COMPARISON_TYPE).asText());
        var select = filter.get(FIELD_SUBQUERY).get(FIELD_NODE);
        assertEquals("members", Transformations.getAllTablesFromSelect(select).get(0).table());
        assertEquals(1, Transformations.collectFunction(filter, "uid").size());
        assertNull(ExpressionFactory.exists(membership).get(FIELD_CHILD));
    }
}
