package com.viewstate.drg.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of a JSON view definition.
 *
 * <pre>
 * { "view": {
 *     "name": "product_edit",
 *     "fields": [ { "name": "product_id", "type": "string", "storage": "url" } ],
 *     "reads":  [ { "name": "product", "resource": "Product", "id": "field:product_id" } ],
 *     "forms":  [ { "name": "form", "resource": "Product", "data": "result:product" } ],
 *     "derive": [ { "name": "title", "fn": "identity", "arguments": ["result:product"] } ] } }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ViewDocument {
    private ViewInfo view;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ViewInfo {
        private String name, description;
        private List<FieldDef> fields;
        private List<String> props;
        private List<DeriveDef> derive;
        private List<ReadDef> reads;
        private List<FormDef> forms;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FieldDef {
        private String name, type, storage;
        @JsonProperty("default")
        private Object defaultValue;
    }

    /** A derived node whose compute function is looked up by name. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class DeriveDef {
        private String name, fn, description;
        private List<String> arguments;
        private boolean async;
        private List<String> reads;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ReadDef {
        private String name, resource, id, action;
        private Boolean async;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FormDef {
        private String name, resource, data, params;
        @JsonProperty("create")
        private String createAction;
        @JsonProperty("update")
        private String updateAction;
    }
}
