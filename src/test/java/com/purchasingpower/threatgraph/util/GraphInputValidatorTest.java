package com.purchasingpower.threatgraph.util;

import com.purchasingpower.threatgraph.exception.InvalidGraphInputException;
import com.purchasingpower.threatgraph.model.graph.GraphNode;
import com.purchasingpower.threatgraph.model.graph.NodeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphInputValidatorTest {

    @Test
    @DisplayName("Weights at the bounds are accepted")
    void weightBounds() {
        assertThatCode(() -> GraphInputValidator.validateWeight(0.0)).doesNotThrowAnyException();
        assertThatCode(() -> GraphInputValidator.validateWeight(1.0)).doesNotThrowAnyException();
        assertThatThrownBy(() -> GraphInputValidator.validateWeight(-0.01))
                .isInstanceOf(InvalidGraphInputException.class)
                .hasFieldOrPropertyWithValue("field", "weight");
    }

    @Test
    @DisplayName("Depth must lie within 1 and the configured maximum")
    void depthBounds() {
        assertThatCode(() -> GraphInputValidator.validateDepth(1, 5)).doesNotThrowAnyException();
        assertThatCode(() -> GraphInputValidator.validateDepth(5, 5)).doesNotThrowAnyException();
        assertThatThrownBy(() -> GraphInputValidator.validateDepth(0, 5))
                .isInstanceOf(InvalidGraphInputException.class)
                .hasMessageContaining("between 1 and 5");
    }

    @Test
    @DisplayName("Nodes need an id, a type and a label")
    void nodeShape() {
        assertThatThrownBy(() -> GraphInputValidator.validateNode(null))
                .isInstanceOf(InvalidGraphInputException.class);
        assertThatThrownBy(() -> GraphInputValidator.validateNode(
                GraphNode.builder().id("a1").label("A1").size(1.0).build()))
                .hasFieldOrPropertyWithValue("field", "nodeType");
        assertThatThrownBy(() -> GraphInputValidator.validateNode(
                GraphNode.builder().id("a1").type(NodeType.ARTICLE).size(1.0).build()))
                .hasFieldOrPropertyWithValue("field", "label");
    }
}
