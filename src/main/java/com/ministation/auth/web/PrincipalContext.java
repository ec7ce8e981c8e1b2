package com.ministation.auth.web;

/**
 * 请求级别的“当前 principal”上下文。
 *
 * <p>principal 由上游身份网关解析并通过 {@code X-Principal} 头传入，本服务完全信任它，不做认证。
 * 拦截器把它放到 ThreadLocal 里，方便 controller 随取随用。</p>
 *
 * <p>注意：ThreadLocal 一定要在请求结束时清理，否则线程复用时会串号。
 * 我们在 PrincipalInterceptor#afterCompletion 里 clear。</p>
 */
public final class PrincipalContext {

    private static final ThreadLocal<String> PRINCIPAL = new ThreadLocal<>();

    private PrincipalContext() {
    }

    public static void setPrincipal(String principal) {
        PRINCIPAL.set(principal);
    }

    public static String getPrincipal() {
        return PRINCIPAL.get();
    }

    public static void clear() {
        PRINCIPAL.remove();
    }
}
