package com.ryuqq.jobstore.core.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Portable description of what a job calls: declaring type, method, parameter types and
 * JSON-serialized arguments.
 *
 * <p>Type names are fully qualified Java binary names. {@code arguments} holds one JSON
 * string per parameter, {@code null} entries standing for null arguments.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class InvocationData {

    private String type;
    private String method;
    private List<String> parameterTypes = new ArrayList<>();
    private List<String> arguments = new ArrayList<>();
    private List<String> genericArguments;

    public InvocationData() {
    }

    public InvocationData(String type, String method, List<String> parameterTypes,
                          List<String> arguments, List<String> genericArguments) {
        this.type = type;
        this.method = method;
        this.parameterTypes = parameterTypes == null ? new ArrayList<>() : new ArrayList<>(parameterTypes);
        this.arguments = arguments == null ? new ArrayList<>() : new ArrayList<>(arguments);
        this.genericArguments = genericArguments == null ? null : new ArrayList<>(genericArguments);
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public List<String> getParameterTypes() {
        return parameterTypes;
    }

    public void setParameterTypes(List<String> parameterTypes) {
        this.parameterTypes = parameterTypes == null ? new ArrayList<>() : parameterTypes;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public void setArguments(List<String> arguments) {
        this.arguments = arguments == null ? new ArrayList<>() : arguments;
    }

    public List<String> getGenericArguments() {
        return genericArguments;
    }

    public void setGenericArguments(List<String> genericArguments) {
        this.genericArguments = genericArguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InvocationData that = (InvocationData) o;
        return Objects.equals(type, that.type)
            && Objects.equals(method, that.method)
            && Objects.equals(parameterTypes, that.parameterTypes)
            && Objects.equals(arguments, that.arguments)
            && Objects.equals(genericArguments, that.genericArguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, method, parameterTypes, arguments, genericArguments);
    }

    @Override
    public String toString() {
        return "InvocationData{" + type + '.' + method + parameterTypes + '}';
    }
}
