package com.chatsync.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.ContextualSerializer;

import java.io.IOException;
import java.util.Locale;

/**
 * 把语义为 id 的 long 字段写成 JSON string，其余 long（total、fileSize、retryAfter）保持 number。
 *
 * <p>按属性名判定：{@code id}、以 {@code Id}/{@code Ids} 结尾、以 {@code By} 结尾（pinnedBy、seenBy）。
 * 集合属性的元素序列化器也会拿到外层属性名，所以 {@code memberIds} 里的每个元素同样输出为字符串。</p>
 */
public class IdLongJsonSerializer extends JsonSerializer<Long> implements ContextualSerializer {

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
        return new IdLongJsonSerializer(isIdProperty(property.getName()));
    }

    static boolean isIdProperty(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.equals("id") || lower.endsWith("id") || lower.endsWith("ids") || lower.endsWith("by");
    }
}
