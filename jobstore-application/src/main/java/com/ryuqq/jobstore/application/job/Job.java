package com.ryuqq.jobstore.application.job;

import com.ryuqq.jobstore.core.document.JobDocument;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 실행할 메서드 호출 정의.
 *
 * <p>대상 타입, 메서드, 인자, 큐 이름으로 구성되며 불변입니다.
 * 저장 시 {@link InvocationSerializer}가 이름과 JSON 인자로 변환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Job job = Job.of(ReportService.class, "generate", "2024-01", 3).onQueue("reports");
 * }</pre>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class Job {

    private final Class<?> type;
    private final Method method;
    private final List<Object> args;
    private final String queue;

    private Job(Class<?> type, Method method, List<Object> args, String queue) {
        this.type = type;
        this.method = method;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.queue = queue == null || queue.isBlank() ? JobDocument.DEFAULT_QUEUE : queue;
    }

    /**
     * 메서드 이름과 인자로 Job 생성.
     *
     * <p>이름과 인자 개수가 같고 인자 타입이 호환되는 public 메서드를 찾습니다.</p>
     *
     * @param type 대상 타입
     * @param methodName 메서드 이름
     * @param args 인자
     * @return Job (기본 큐)
     * @throws IllegalArgumentException 맞는 메서드가 없거나 둘 이상인 경우
     */
    public static Job of(Class<?> type, String methodName, Object... args) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (methodName == null || methodName.isBlank()) {
            throw new IllegalArgumentException("methodName cannot be null or blank");
        }
        Object[] actualArgs = args == null ? new Object[0] : args;

        Method found = null;
        for (Method candidate : type.getMethods()) {
            if (candidate.getName().equals(methodName) && accepts(candidate, actualArgs)) {
                if (found != null) {
                    throw new IllegalArgumentException(
                        "Ambiguous method " + type.getName() + "." + methodName + " for " + actualArgs.length + " arguments"
                    );
                }
                found = candidate;
            }
        }
        if (found == null) {
            throw new IllegalArgumentException(
                "No public method " + type.getName() + "." + methodName + " accepts " + Arrays.toString(actualArgs)
            );
        }
        return new Job(type, found, Arrays.asList(actualArgs), null);
    }

    /**
     * 메서드와 인자로 Job 생성.
     *
     * @param type 대상 타입
     * @param method 메서드
     * @param args 인자 (메서드 파라미터 수와 같아야 함)
     * @return Job (기본 큐)
     */
    public static Job fromMethod(Class<?> type, Method method, List<?> args) {
        if (type == null || method == null) {
            throw new IllegalArgumentException("type and method cannot be null");
        }
        List<Object> actualArgs = args == null ? List.of() : new ArrayList<>(args);
        if (actualArgs.size() != method.getParameterCount()) {
            throw new IllegalArgumentException(
                "Method " + method.getName() + " expects " + method.getParameterCount()
                    + " arguments (given: " + actualArgs.size() + ")"
            );
        }
        return new Job(type, method, actualArgs, null);
    }

    /**
     * 큐를 지정한 복사본.
     *
     * @param queueName 큐 이름 (blank면 기본 큐)
     * @return 새 Job
     */
    public Job onQueue(String queueName) {
        return new Job(type, method, args, queueName);
    }

    public Class<?> getType() {
        return type;
    }

    public Method getMethod() {
        return method;
    }

    public List<Object> getArgs() {
        return args;
    }

    public String getQueue() {
        return queue;
    }

    public boolean isStatic() {
        return Modifier.isStatic(method.getModifiers());
    }

    /**
     * 표시용 이름 ({@code Type.method}).
     *
     * @return 표시 이름
     */
    public String displayName() {
        return type.getSimpleName() + "." + method.getName();
    }

    private static boolean accepts(Method method, Object[] args) {
        Class<?>[] parameterTypes = method.getParameterTypes();
        if (parameterTypes.length != args.length) {
            return false;
        }
        for (int i = 0; i < parameterTypes.length; i++) {
            if (args[i] == null) {
                if (parameterTypes[i].isPrimitive()) {
                    return false;
                }
                continue;
            }
            if (!box(parameterTypes[i]).isInstance(args[i])) {
                return false;
            }
        }
        return true;
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) {
            return Integer.class;
        }
        if (type == long.class) {
            return Long.class;
        }
        if (type == boolean.class) {
            return Boolean.class;
        }
        if (type == double.class) {
            return Double.class;
        }
        if (type == float.class) {
            return Float.class;
        }
        if (type == short.class) {
            return Short.class;
        }
        if (type == byte.class) {
            return Byte.class;
        }
        return Character.class;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Job other)) {
            return false;
        }
        return type.equals(other.type) && method.equals(other.method)
            && args.equals(other.args) && queue.equals(other.queue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, method, args, queue);
    }

    @Override
    public String toString() {
        return "Job{" + displayName() + ", args=" + args + ", queue='" + queue + "'}";
    }
}
