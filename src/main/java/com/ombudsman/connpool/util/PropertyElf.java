/*
 * Copyright (C) 2013, 2014 Brett Wooldridge
 *
 * Modifications made by Foulest (https://github.com/Foulest)
 * for the HikariCP fork (https://github.com/Foulest/HikariCP).
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.ombudsman.connpool.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reflectively copies {@link Properties}-style key/value pairs onto bean setters,
 * converting the textual value to the setter's parameter type.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class PropertyElf {

    private static final Pattern GETTER_PATTERN = Pattern.compile("(get|is)[A-Z].+");

    public static void setTargetFromProperties(Object target, Map<Object, Object> properties) {
        if (target == null || properties == null) {
            return;
        }

        List<Method> methods = Arrays.asList(target.getClass().getMethods());
        properties.forEach((key, value) -> setProperty(target, key.toString().trim(), value, methods));
    }

    /**
     * Get the bean-style property names for the specified class.
     *
     * @param targetClass the target class
     * @return a set of property names
     */
    public static @NotNull Set<String> getPropertyNames(@NotNull Class<?> targetClass) {
        Set<String> set = new HashSet<>();
        Matcher matcher = GETTER_PATTERN.matcher("");

        for (Method method : targetClass.getMethods()) {
            String name = method.getName();

            if (method.getParameterTypes().length == 0 && matcher.reset(name).matches()
                    && method.getDeclaringClass() != Object.class) {
                name = name.replaceFirst("(get|is)", "");
                name = Character.toLowerCase(name.charAt(0)) + name.substring(1);
                set.add(name);
            }
        }
        return set;
    }

    public static @Nullable Object getProperty(@NotNull String propName, @NotNull Object target) {
        String suffix = propName.substring(0, 1).toUpperCase(Locale.ROOT) + propName.substring(1);

        for (String prefix : new String[]{"get", "is"}) {
            try {
                Method method = target.getClass().getMethod(prefix + suffix);
                return method.invoke(target);
            } catch (NoSuchMethodException | SecurityException | IllegalAccessException
                     | IllegalArgumentException | InvocationTargetException ignored) {
                // try the next accessor form
            }
        }
        return null;
    }

    private static void setProperty(Object target, @NotNull String propName,
                                    Object propValue, @NotNull Collection<Method> methods) {
        String methodName = "set" + propName.substring(0, 1).toUpperCase(Locale.ROOT) + propName.substring(1);

        Method writeMethod = methods.stream()
                .filter(m -> m.getName().equals(methodName) && m.getParameterCount() == 1)
                .findFirst()
                .orElse(null);

        if (writeMethod == null) {
            log.error("Property {} does not exist on target {}", propName, target.getClass());
            throw new IllegalArgumentException(String.format("Property %s does not exist on target %s",
                    propName, target.getClass()));
        }

        try {
            invokeWriteMethod(writeMethod, target, propValue, writeMethod.getParameterTypes()[0]);
        } catch (InvocationTargetException ex) {
            Throwable cause = ex.getCause();

            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalArgumentException("Failed to set property " + propName, cause);
        } catch (IllegalAccessException ex) {
            log.error("Failed to set property {} on target {}", propName, target.getClass(), ex);
            throw new IllegalArgumentException("Failed to set property " + propName, ex);
        }
    }

    private static void invokeWriteMethod(Method writeMethod, Object target, Object propValue, Class<?> paramClass)
            throws InvocationTargetException, IllegalAccessException {
        String text = propValue.toString().trim();

        if (paramClass == int.class) {
            writeMethod.invoke(target, Integer.parseInt(text));
        } else if (paramClass == long.class) {
            writeMethod.invoke(target, Long.parseLong(text));
        } else if (paramClass == boolean.class || paramClass == Boolean.class) {
            writeMethod.invoke(target, Boolean.parseBoolean(text));
        } else if (paramClass == String.class) {
            writeMethod.invoke(target, text);
        } else if (paramClass.isInstance(propValue)) {
            writeMethod.invoke(target, propValue);
        } else {
            try {
                log.debug("Try to create a new instance of \"{}\"", text);
                writeMethod.invoke(target, Class.forName(text).getDeclaredConstructor().newInstance());
            } catch (ReflectiveOperationException ex) {
                throw new IllegalArgumentException("Cannot convert \"" + text + "\" to " + paramClass.getName(), ex);
            }
        }
    }
}
