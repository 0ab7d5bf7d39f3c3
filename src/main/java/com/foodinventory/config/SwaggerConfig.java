package com.foodinventory.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 문서 설정
 *
 * Swagger UI: /swagger-ui.html
 * 검색 API는 Open Food Facts 응답을 가공해 내려주므로 원본 API 문서를 외부 문서로 연결합니다.
 */
@Configuration
public class SwaggerConfig {

    private static final String OPEN_FOOD_FACTS_API_DOCS = "https://openfoodfacts.github.io/openfoodfacts-server/api/";

    @Bean
    public OpenAPI openAPI(@Value("${spring.application.name:food-inventory-server}") String applicationName) {
        return new OpenAPI()
                .info(new Info()
                        .title(applicationName)
                        .description("식품 재고 등록/조회/변경/삭제 API와 Open Food Facts 카탈로그 검색 API. "
                                + "재고 목록은 (name, brands) 단위로 묶여 count와 함께 반환됩니다.")
                        .version("v1"))
                .externalDocs(new ExternalDocumentation()
                        .description("Open Food Facts API")
                        .url(OPEN_FOOD_FACTS_API_DOCS));
    }
}
