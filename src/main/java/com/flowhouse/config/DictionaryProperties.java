package com.flowhouse.config;

import com.flowhouse.domain.DictionaryBinding;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Dictionary bindings from configuration.
 *
 * <pre>
 * flowhouse:
 *   dicts:
 *     - field: src_asn
 *       dict: asn_dict
 *       expr: toUInt64(%s)
 *     - field: int_in
 *       dict: interfaces
 *       expr: tuple(IPv6NumToString(%s), %s)
 *       keys: [agent, int_in]
 * </pre>
 */
@ConfigurationProperties(prefix = "flowhouse")
public class DictionaryProperties {

    private List<Dict> dicts = new ArrayList<>();

    public List<Dict> getDicts() {
        return dicts;
    }

    public void setDicts(List<Dict> dicts) {
        this.dicts = dicts;
    }

    public List<DictionaryBinding> toBindings() {
        return dicts.stream()
            .map(d -> new DictionaryBinding(d.getField(), d.getDict(), d.getExpr(), d.getKeys()))
            .collect(Collectors.toList());
    }

    public static class Dict {
        private String field;
        private String dict;
        private String expr;
        private List<String> keys = new ArrayList<>();

        public String getField() {
            return field;
        }

        public void setField(String field) {
            this.field = field;
        }

        public String getDict() {
            return dict;
        }

        public void setDict(String dict) {
            this.dict = dict;
        }

        public String getExpr() {
            return expr;
        }

        public void setExpr(String expr) {
            this.expr = expr;
        }

        public List<String> getKeys() {
            return keys;
        }

        public void setKeys(List<String> keys) {
            this.keys = keys;
        }
    }
}
