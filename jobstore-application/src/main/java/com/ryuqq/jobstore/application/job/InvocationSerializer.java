package com.ryuqq.jobstore.application.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.jobstore.core.document.InvocationData;

import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link Job} ↔ {@link InvocationData} 변환기.
 *
 * <p>타입과 파라미터 타입은 이름으로, 인자는 Jackson JSON 문자열로 저장합니다.
 * 복원 시 파라미터의 제네릭 타입으로 인자를 역직렬화합니다.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class InvocationSerializer {

    private static final Map<String, Class<?>> PRIMITIVES = Map.of(
        "int", int.class,
        "long", long.class,
        "boolean", boolean.class,
        "double", double.class,
        "float", float.class,
        "short", short.class,
        "byte", byte.class,
        "char", char.class
    );

    private final ObjectMapper objectMapper;

    public InvocationSerializer(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * Job을 저장 형태로 변환.
     *
     * @param job 변환할 Job
     * @return 호출 정보
     * @throws InvocationDataException 인자를 JSON으로 변환할 수 없는 경우
     */
    public InvocationData serialize(Job job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        Method method = job.getMethod();

        List<String> parameterTypes = new ArrayList<>();
        for (Class<?> parameterType : method.getParameterTypes()) {
            parameterTypes.add(parameterType.getName());
        }

        List<String> arguments = new ArrayList<>();
        for (Object arg : job.getArgs()) {
            try {
                arguments.add(arg == null ? null : objectMapper.writeValueAsString(arg));
            } catch (JsonProcessingException e) {
                throw new InvocationDataException(
                    "Failed to serialize argument of " + job.displayName() + ": " + e.getOriginalMessage(), e
                );
            }
        }

        List<String> genericArguments = null;
        TypeVariable<Method>[] typeParameters = method.getTypeParameters();
        if (typeParameters.length > 0) {
            genericArguments = new ArrayList<>();
            for (TypeVariable<Method> typeParameter : typeParameters) {
                genericArguments.add(typeParameter.getName());
            }
        }

        return new InvocationData(job.getType().getName(), method.getName(), parameterTypes, arguments,
            genericArguments);
    }

    /**
     * 저장 형태를 Job으로 복원.
     *
     * @param data 호출 정보
     * @return Job (기본 큐, 큐는 호출자가 지정)
     * @throws InvocationDataException 타입, 메서드, 인자 중 하나라도 복원할 수 없는 경우
     */
    public Job deserialize(InvocationData data) {
        if (data == null) {
            throw new InvocationDataException("Invocation data is missing");
        }
        Class<?> type = loadClass(data.getType());

        List<String> parameterTypeNames = data.getParameterTypes() == null ? List.of() : data.getParameterTypes();
        Class<?>[] parameterTypes = new Class<?>[parameterTypeNames.size()];
        for (int i = 0; i < parameterTypes.length; i++) {
            parameterTypes[i] = loadClass(parameterTypeNames.get(i));
        }

        Method method;
        try {
            method = type.getMethod(data.getMethod(), parameterTypes);
        } catch (NoSuchMethodException e) {
            throw new InvocationDataException(
                "Method " + data.getType() + "." + data.getMethod() + parameterTypeNames + " no longer exists", e
            );
        }

        List<String> arguments = data.getArguments() == null ? List.of() : data.getArguments();
        if (arguments.size() != parameterTypes.length) {
            throw new InvocationDataException(
                "Argument count mismatch for " + data.getType() + "." + data.getMethod()
                    + " (expected: " + parameterTypes.length + ", stored: " + arguments.size() + ")"
            );
        }

        Type[] genericTypes = method.getGenericParameterTypes();
        List<Object> args = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            String json = arguments.get(i);
            if (json == null) {
                args.add(null);
                continue;
            }
            JavaType javaType = objectMapper.getTypeFactory().constructType(genericTypes[i]);
            try {
                args.add(objectMapper.readValue(json, javaType));
            } catch (JsonProcessingException e) {
                throw new InvocationDataException(
                    "Failed to deserialize argument " + i + " of " + data.getType() + "." + data.getMethod()
                        + ": " + e.getOriginalMessage(), e
                );
            }
        }
        return Job.fromMethod(type, method, args);
    }

    private static Class<?> loadClass(String name) {
        if (name == null || name.isBlank()) {
            throw new InvocationDataException("Type name is missing");
        }
        Class<?> primitive = PRIMITIVES.get(name);
        if (primitive != null) {
            return primitive;
        }
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = InvocationSerializer.class.getClassLoader();
        }
        try {
            return Class.forName(name, false, loader);
        } catch (ClassNotFoundException e) {
            throw new InvocationDataException("Type " + name + " cannot be loaded", e);
        }
    }
}
