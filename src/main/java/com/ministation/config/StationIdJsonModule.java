package com.ministation.config;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.util.List;

/**
 * 雪花 ID 超出 JS Number 安全范围：bean 上名为 {@code id} 或以 {@code Id} 结尾的 long 属性输出为字符串。
 *
 * <p>memberCount、upvotes、karma 等计数属性不受影响，仍为 JSON number。</p>
 */
public class StationIdJsonModule extends SimpleModule {

    public StationIdJsonModule() {
        super("station-id-module");
        setSerializerModifier(new BeanSerializerModifier() {
            @Override
            public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                             BeanDescription beanDesc,
                                                             List<BeanPropertyWriter> beanProperties) {
                for (BeanPropertyWriter writer : beanProperties) {
                    if (!writer.hasSerializer() && isLong(writer.getType().getRawClass()) && isIdProperty(writer.getName())) {
                        writer.assignSerializer(ToStringSerializer.instance);
                    }
                }
                return beanProperties;
            }
        });
    }

    static boolean isIdProperty(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        return name.equals("id") || (name.length() > 2 && name.endsWith("Id"));
    }

    private static boolean isLong(Class<?> type) {
        return type == Long.class || type == long.class;
    }
}
