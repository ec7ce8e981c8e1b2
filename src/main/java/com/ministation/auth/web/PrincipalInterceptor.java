package com.ministation.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ministation.common.api.ApiCodes;
import com.ministation.common.api.Result;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 读取网关写入的 {@code X-Principal}：
 * <ul>
 *   <li>GET 请求：可以匿名（station / post 列表是公开的）</li>
 *   <li>其它请求：必须带 principal，否则返回 401 + 统一 Result JSON</li>
 * </ul>
 */
@Component
public class PrincipalInterceptor implements HandlerInterceptor {

    public static final String HEADER = "X-Principal";

    private static final Logger log = LoggerFactory.getLogger(PrincipalInterceptor.class);
    private static final int MAX_PRINCIPAL_LEN = 64;

    private final ObjectMapper objectMapper;

    public PrincipalInterceptor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String principal = normalize(request.getHeader(HEADER));
        if (principal != null) {
            PrincipalContext.setPrincipal(principal);
            return true;
        }
        if ("GET".equalsIgnoreCase(request.getMethod()) || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        response.setStatus(401);
        response.setCharacterEncoding("UTF-8");
        response.setContentType("application/json;charset=UTF-8");
        try {
            String json = objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized"));
            response.getWriter().write(json);
        } catch (Exception writeErr) {
            log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
        }
        return false;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        PrincipalContext.clear();
    }

    static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String s = raw.trim();
        if (s.isEmpty() || s.length() > MAX_PRINCIPAL_LEN) {
            return null;
        }
        return s;
    }
}
