package com.viewstate.drg.dsl;

import com.viewstate.drg.api.GraphConfigurationException;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class ViewBuilderTest {

    @Test
    public void testBuildsFieldsPropsAndDeclarations() {
        ViewDefinition def = ViewDefinition.builder("edit")
                .field("product_id", FieldType.STRING, StorageClass.URL, null)
                .prop("tenant")
                .read("product", "Product", SourceRef.field("product_id"))
                .form("form", "Product", SourceRef.result("product"))
                .build();

        assertEquals("edit", def.name());
        assertTrue(def.isField("product_id"));
        assertTrue(def.isProp("tenant"));
        assertEquals(2, def.declarations().size());
        assertEquals(StorageClass.URL, def.fields().get("product_id").storage());
    }

    @Test
    public void testImplicitFormParamsField() {
        ViewDefinition def = ViewDefinition.builder("edit")
                .form("form", "Product", null)
                .build();
        FieldDefinition params = def.fields().get("form_params");
        assertNotNull(params);
        assertEquals(Map.of(), params.defaultValue());
        assertEquals(StorageClass.EPHEMERAL, params.storage());
    }

    @Test
    public void testExplicitParamsFieldIsKept() {
        ViewDefinition def = ViewDefinition.builder("edit")
                .field("form_params", Map.of("name", "x"))
                .form("form", "Product", null)
                .build();
        assertEquals(Map.of("name", "x"), def.fields().get("form_params").defaultValue());
    }

    @Test(expected = GraphConfigurationException.class)
    public void testDuplicateNameRejected() {
        ViewDefinition.builder("v").field("x", 1).derive("x", d -> null, "field:x");
    }

    @Test(expected = IllegalStateException.class)
    public void testNoChangesAfterBuild() {
        ViewBuilder b = ViewDefinition.builder("v");
        b.build();
        b.field("late", 1);
    }
}
