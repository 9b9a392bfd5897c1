package com.pkgmeta.core.metadata;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata exposed as the named properties of a Java object.
 *
 * <p>Record components and JavaBean getters are published under their
 * snake_case names, so a component {@code authorEmail} answers to the field
 * name {@code author_email}. Only named-field access is supported.
 */
public final class BeanMetadata implements MetadataSource {

    private static final String GETTER_PREFIX = "get";

    private final Map<String, Object> properties;
    private final Object bean;

    public BeanMetadata(Object bean) {
        this.bean = Objects.requireNonNull(bean, "bean must not be null");
        this.properties = Collections.unmodifiableMap(introspect(bean));
    }

    @Override
    public boolean hasNamedFields() {
        return true;
    }

    @Override
    public Object namedField(String name) {
        return properties.get(name);
    }

    @Override
    public String toString() {
        return "BeanMetadata[" + bean.getClass().getSimpleName() + "]";
    }

    private static Map<String, Object> introspect(Object bean) {
        Map<String, Object> values = new LinkedHashMap<>();
        Class<?> type = bean.getClass();
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                values.put(toSnakeCase(component.getName()), invoke(component.getAccessor(), bean));
            }
            return values;
        }
        for (Method method : type.getMethods()) {
            String methodName = method.getName();
            if (method.getParameterCount() == 0
                    && !Modifier.isStatic(method.getModifiers())
                    && methodName.startsWith(GETTER_PREFIX)
                    && methodName.length() > GETTER_PREFIX.length()
                    && !"getClass".equals(methodName)) {
                String property = Character.toLowerCase(methodName.charAt(3)) + methodName.substring(4);
                values.put(toSnakeCase(property), invoke(method, bean));
            }
        }
        return values;
    }

    private static Object invoke(Method accessor, Object bean) {
        try {
            accessor.trySetAccessible();
            return accessor.invoke(bean);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read property " + accessor.getName()
                + " of " + bean.getClass().getName(), e);
        }
    }

    static String toSnakeCase(String camelCase) {
        StringBuilder snake = new StringBuilder(camelCase.length() + 4);
        for (int i = 0; i < camelCase.length(); i++) {
            char c = camelCase.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    snake.append('_');
                }
                snake.append(Character.toLowerCase(c));
            } else {
                snake.append(c);
            }
        }
        return snake.toString();
    }
}
