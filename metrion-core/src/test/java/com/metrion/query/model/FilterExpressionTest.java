package com.metrion.query.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class FilterExpressionTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void missingOperatorDefaultsToEq() {
        FilterExpression expr = new FilterExpression("resource_id", null, "bd9431c1", null);

        assertThat(expr.op()).isEqualTo(ComparisonOperator.EQ);
    }

    @Test
    void blankTypeIsTreatedAsUndeclared() {
        FilterExpression expr = new FilterExpression("metadata.size", ComparisonOperator.EQ, "42", " ");

        assertThat(expr.hasDeclaredType()).isFalse();
        assertThat(expr.type()).isNull();
    }

    @Test
    void readsWireFormWithoutOperator() throws Exception {
        FilterExpression expr =
                mapper.readValue("{\"field\":\"metadata.flavor\",\"value\":\"m1.tiny\"}", FilterExpression.class);

        assertThat(expr.field()).isEqualTo("metadata.flavor");
        assertThat(expr.op()).isEqualTo(ComparisonOperator.EQ);
        assertThat(expr.value()).isEqualTo("m1.tiny");
    }

    @Test
    void readsWireFormWithOperatorAndType() throws Exception {
        FilterExpression expr = mapper.readValue(
                "{\"field\":\"metadata.size\",\"op\":\"GE\",\"value\":\"3\",\"type\":\"integer\"}",
                FilterExpression.class);

        assertThat(expr.op()).isEqualTo(ComparisonOperator.GE);
        assertThat(expr.type()).isEqualTo("integer");
    }

    @Test
    void rejectsUnknownOperatorToken() {
        assertThatThrownBy(() -> ComparisonOperator.fromString("like"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("like");
        assertThatThrownBy(() -> mapper.readValue(
                        "{\"field\":\"user_id\",\"op\":\"between\",\"value\":\"x\"}", FilterExpression.class))
                .isInstanceOf(JsonMappingException.class);
    }

    @Test
    void rejectsMissingFieldOrValue() {
        assertThatThrownBy(() -> FilterExpression.eq(" ", "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FilterExpression.eq("user_id", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("user_id");
    }

    @Test
    void operatorBoundsAreClassified() {
        assertThat(ComparisonOperator.LT.isUpperBound()).isTrue();
        assertThat(ComparisonOperator.LE.isUpperBound()).isTrue();
        assertThat(ComparisonOperator.GT.isLowerBound()).isTrue();
        assertThat(ComparisonOperator.GE.isLowerBound()).isTrue();
        assertThat(ComparisonOperator.EQ.isLowerBound()).isFalse();
        assertThat(ComparisonOperator.NE.isUpperBound()).isFalse();
    }
}
