package com.yerin.syncwatch.config;

import com.yerin.syncwatch.web.AdminTokenInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final AdminTokenInterceptor adminTokenInterceptor;
    private final String[] allowedOrigins;

    public WebMvcConfig(AdminTokenInterceptor adminTokenInterceptor,
                        @Value("${syncwatch.allowed-origins:*}") String[] allowedOrigins) {
        this.adminTokenInterceptor = adminTokenInterceptor;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        // 스케줄러 제어, 작업 취소/재시도, 운영 지표는 모두 /admin 아래에 둔다
        registry.addInterceptor(adminTokenInterceptor).addPathPatterns("/admin/**");
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // 대시보드는 다른 오리진에서 REST 와 WebSocket 을 같이 쓴다
        registry.addMapping("/**")
                .allowedOriginPatterns(allowedOrigins)
                .allowedMethods("GET", "POST", "PUT", "OPTIONS")
                .allowedHeaders("*");
    }
}
