package com.vaultrebalancer.config;

import com.vaultrebalancer.api.dto.response.ApiErrorResponse;
import com.vaultrebalancer.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps every operations API body in the {@code {success, data, timestamp}} envelope, so
 * controllers return plain round results, plans and status objects.
 *
 * <p>Actuator output, the error page, envelopes built elsewhere and plain strings pass through.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        if (isPassThrough(request.getURI().getPath()) || body instanceof ApiResponse<?>
                || body instanceof ApiErrorResponse) {
            return body;
        }
        return ApiResponse.of(body);
    }

    private static boolean isPassThrough(String path) {
        return path.startsWith("/actuator") || "/error".equals(path);
    }
}
