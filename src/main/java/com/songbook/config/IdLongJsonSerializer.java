package com.songbook.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.ContextualSerializer;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * 雪花 ID 超过 JS Number 的安全整数范围，ID 语义的 long 字段统一输出为字符串。
 *
 * <p>判定规则：字段名为 {@code id}、以 {@code Id} 结尾，或者是操作人字段
 * （{@code createdBy}/{@code changedBy}/{@code resolvedBy}/{@code invitedBy}/{@code addedBy}）。
 * 版本号、计数等其它 long 保持 number。</p>
 */
public class IdLongJsonSerializer extends JsonSerializer<Long> implements ContextualSerializer {

    private static final Set<String> ACTOR_FIELDS = Set.of("createdby", "changedby", "resolvedby", "invitedby", "addedby");

    private final boolean asString;

    public IdLongJsonSerializer() {
        this(false);
    }

    private IdLongJsonSerializer(boolean asString) {
        this.asString = asString;
    }

    @Override
    public void serialize(Long value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (asString) {
            gen.writeString(Long.toString(value));
        } else {
            gen.writeNumber(value);
        }
    }

    @Override
    public JsonSerializer<?> createContextual(SerializerProvider prov, BeanProperty property) {
        if (property == null) {
            return this;
        }
        return new IdLongJsonSerializer(isIdFieldName(property.getName()));
    }

    static boolean isIdFieldName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.equals("id") || lower.endsWith("id") || ACTOR_FIELDS.contains(lower);
    }
}
