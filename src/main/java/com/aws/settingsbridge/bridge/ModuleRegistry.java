/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.settingsbridge.bridge;

import com.aws.settingsbridge.util.Coerce;
import com.aws.settingsbridge.util.Utils;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;

import static com.aws.settingsbridge.bridge.ExceptionUtil.translateExceptions;

/**
 * Host-side registry of {@link BridgeModule}s. Modules are discovered by name and their {@link BridgeMethod}
 * operations are dispatched by name with arguments coerced to the declared parameter types.
 */
public class ModuleRegistry implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(ModuleRegistry.class);
    private static final String MODULE_NAME = "module";
    private static final String METHOD_NAME = "method";

    private final Map<String, RegisteredModule> modules = new ConcurrentHashMap<>();
    @Getter
    private final DeviceEventEmitter eventEmitter;
    private final AtomicBoolean closed = new AtomicBoolean();

    public ModuleRegistry() {
        this(new DeviceEventEmitter());
    }

    public ModuleRegistry(DeviceEventEmitter eventEmitter) {
        this.eventEmitter = Objects.requireNonNull(eventEmitter, "eventEmitter");
    }

    /**
     * Register a module and discover its operations.
     *
     * @param module module to register
     * @throws IllegalArgumentException if the name is empty or taken, or two operations share a name
     * @throws IllegalStateException    if the registry was closed
     */
    public void register(BridgeModule module) {
        Objects.requireNonNull(module, "module");
        if (closed.get()) {
            throw new IllegalStateException("Module registry is closed");
        }
        String name = module.getName();
        if (Utils.isEmpty(name)) {
            throw new IllegalArgumentException("Module name cannot be empty: " + module.getClass().getName());
        }

        Map<String, Method> methods = new HashMap<>();
        for (Method m : module.getClass().getMethods()) {
            BridgeMethod annotation = m.getAnnotation(BridgeMethod.class);
            if (annotation == null) {
                continue;
            }
            String opName = Utils.isEmpty(annotation.value()) ? m.getName() : annotation.value();
            if (methods.putIfAbsent(opName, m) != null) {
                throw new IllegalArgumentException(
                        "Module " + name + " declares more than one operation named " + opName);
            }
            if (!Modifier.isPublic(m.getDeclaringClass().getModifiers())) {
                m.setAccessible(true);
            }
        }

        if (modules.putIfAbsent(name, new RegisteredModule(module, Collections.unmodifiableMap(methods))) != null) {
            throw new IllegalArgumentException("Module " + name + " is already registered");
        }
        logger.atInfo().addKeyValue("eventType", "module-registered").addKeyValue(MODULE_NAME, name)
                .addKeyValue("operations", new TreeSet<>(methods.keySet())).log();
    }

    public boolean hasModule(String name) {
        return modules.containsKey(name);
    }

    @Nullable
    public BridgeModule getModule(String name) {
        RegisteredModule rm = modules.get(name);
        return rm == null ? null : rm.getModule();
    }

    public Set<String> getModuleNames() {
        return Collections.unmodifiableSet(new TreeSet<>(modules.keySet()));
    }

    /**
     * Names of the operations a module exposes.
     *
     * @param moduleName module name
     * @return operation names
     * @throws ResourceNotFoundError if no such module is registered
     */
    public Set<String> getMethodNames(String moduleName) {
        return Collections.unmodifiableSet(new TreeSet<>(findModule(moduleName).getMethods().keySet()));
    }

    /**
     * Constants exported by a module.
     *
     * @param moduleName module name
     * @return constants
     * @throws ResourceNotFoundError if no such module is registered
     */
    public Map<String, Object> getConstants(String moduleName) {
        RegisteredModule rm = findModule(moduleName);
        return translateExceptions(() -> rm.getModule().getConstants());
    }

    /**
     * Invoke an operation by name.
     *
     * @param moduleName module name
     * @param methodName operation name
     * @param args       arguments, in declaration order
     * @return the operation result; an empty Optional is returned as null
     * @throws ResourceNotFoundError  if the module or operation does not exist
     * @throws InvalidArgumentsError  if the arguments do not fit the operation
     * @throws ServiceError           if the operation failed
     */
    @Nullable
    public Object invoke(String moduleName, String methodName, @Nullable List<?> args) {
        return translateExceptions(() -> {
            logger.atDebug().addKeyValue(MODULE_NAME, moduleName).addKeyValue(METHOD_NAME, methodName)
                    .log("Bridge invoke request");
            RegisteredModule rm = findModule(moduleName);
            Method m = rm.getMethods().get(methodName);
            if (m == null) {
                throw new ResourceNotFoundError("Module " + moduleName + " has no operation " + methodName);
            }
            List<?> actual = args == null ? Collections.emptyList() : args;
            Class<?>[] types = m.getParameterTypes();
            if (types.length != actual.size()) {
                throw new InvalidArgumentsError(
                        moduleName + "." + methodName + " takes " + types.length + " argument(s), got "
                                + actual.size());
            }
            Object[] coerced = new Object[types.length];
            for (int i = 0; i < types.length; i++) {
                coerced[i] = coerceArgument(actual.get(i), types[i], methodName, i);
            }

            Object result;
            try {
                result = m.invoke(rm.getModule(), coerced);
            } catch (IllegalAccessException e) {
                throw new ServiceError("Operation " + methodName + " is not accessible", e);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                logger.atError().addKeyValue(MODULE_NAME, moduleName).addKeyValue(METHOD_NAME, methodName)
                        .setCause(cause).log("Bridge operation failed");
                throw new ServiceError(String.valueOf(cause), cause);
            }
            if (result instanceof Optional) {
                return ((Optional<?>) result).orElse(null);
            }
            return result;
        });
    }

    @Override
    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        modules.forEach((name, rm) -> {
            try {
                rm.getModule().invalidate();
            } catch (RuntimeException e) {
                logger.atError().addKeyValue("eventType", "module-invalidate-error").addKeyValue(MODULE_NAME, name)
                        .setCause(e).log();
            }
        });
        modules.clear();
        logger.atInfo().addKeyValue("eventType", "module-registry-closed").log();
    }

    private RegisteredModule findModule(String moduleName) {
        RegisteredModule rm = moduleName == null ? null : modules.get(moduleName);
        if (rm == null) {
            throw new ResourceNotFoundError("Module not found: " + moduleName);
        }
        return rm;
    }

    @SuppressWarnings("PMD.CyclomaticComplexity")
    static Object coerceArgument(Object arg, Class<?> type, String methodName, int index) {
        if (arg == null) {
            if (type.isPrimitive()) {
                throw new InvalidArgumentsError(
                        "Argument " + index + " of " + methodName + " cannot be null");
            }
            return null;
        }
        if (type.isInstance(arg) || type == boolean.class && arg instanceof Boolean) {
            return arg;
        }
        try {
            if (type == String.class && (arg instanceof Number || arg instanceof Boolean)) {
                return Coerce.toString(arg);
            }
            if ((type == boolean.class || type == Boolean.class) && arg instanceof String) {
                if (!"true".equals(arg) && !"false".equals(arg)) {
                    throw new InvalidArgumentsError(
                            "Argument " + index + " of " + methodName + " is not a boolean: " + arg);
                }
                return Coerce.toBoolean(arg);
            }
            if (arg instanceof Number || arg instanceof String) {
                if (type == int.class || type == Integer.class) {
                    return Coerce.toInt(arg);
                }
                if (type == long.class || type == Long.class) {
                    return Coerce.toLong(arg);
                }
                if (type == double.class || type == Double.class) {
                    return Coerce.toDouble(arg);
                }
            }
        } catch (NumberFormatException e) {
            throw new InvalidArgumentsError(
                    "Argument " + index + " of " + methodName + " is not a number: " + arg, e);
        } catch (ArithmeticException e) {
            throw new InvalidArgumentsError(
                    "Argument " + index + " of " + methodName + " is out of range: " + arg, e);
        }
        if (type == List.class) {
            if (arg instanceof Collection) {
                return new ArrayList<>((Collection<?>) arg);
            }
            if (arg instanceof Object[]) {
                return Arrays.asList((Object[]) arg);
            }
        }
        throw new InvalidArgumentsError("Argument " + index + " of " + methodName + " must be "
                + type.getSimpleName() + ", got " + arg.getClass().getSimpleName());
    }

    @AllArgsConstructor
    @Getter(AccessLevel.PACKAGE)
    private static class RegisteredModule {
        private final BridgeModule module;
        private final Map<String, Method> methods;
    }
}
