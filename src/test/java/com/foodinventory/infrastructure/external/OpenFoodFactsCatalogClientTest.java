package com.foodinventory.infrastructure.external;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("OpenFoodFactsCatalogClient 테스트")
class OpenFoodFactsCatalogClientTest {

    private static final String BASE_URL = "https://catalog.test";

    private MockRestServiceServer server;
    private OpenFoodFactsCatalogClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new OpenFoodFactsCatalogClient(builder.build());
    }

    @Test
    @DisplayName("검색어로 상품 목록을 조회하고 알 수 없는 필드는 무시한다")
    void search() {
        // given
        String body = """
                {
                  "count": 2,
                  "products": [
                    {
                      "product_name": "Whole Milk",
                      "brands": "Acme",
                      "quantity": "1 L",
                      "categories": "Dairies",
                      "image_url": "https://images.test/milk.jpg",
                      "url": "https://catalog.test/product/1",
                      "ingredients_text": "milk",
                      "nutriscore_grade": "b"
                    },
                    { "product_name": "Skim Milk" }
                  ]
                }
                """;
        server.expect(requestTo(BASE_URL + "/cgi/search.pl?search_terms=milk&json=true"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        // when
        List<OpenFoodFactsProduct> products = client.search("milk");

        // then
        server.verify();
        assertThat(products).hasSize(2);
        assertThat(products.get(0).productName()).isEqualTo("Whole Milk");
        assertThat(products.get(0).ingredientsText()).isEqualTo("milk");
        assertThat(products.get(0).imageUrl()).isEqualTo("https://images.test/milk.jpg");
        assertThat(products.get(1).brands()).isNull();
    }

    @Test
    @DisplayName("검색어의 공백과 특수문자는 인코딩되어 전달된다")
    void search_EncodesTerm() {
        // given
        server.expect(requestTo(BASE_URL + "/cgi/search.pl?search_terms=mac%20%26%20cheese&json=true"))
                .andRespond(withSuccess("{\"products\": []}", MediaType.APPLICATION_JSON));

        // when
        List<OpenFoodFactsProduct> products = client.search("mac & cheese");

        // then
        server.verify();
        assertThat(products).isEmpty();
    }

    @Test
    @DisplayName("products 필드가 없으면 빈 목록을 반환한다")
    void search_MissingProducts() {
        // given
        server.expect(requestTo(BASE_URL + "/cgi/search.pl?search_terms=nothing&json=true"))
                .andRespond(withSuccess("{\"count\": 0}", MediaType.APPLICATION_JSON));

        // when
        List<OpenFoodFactsProduct> products = client.search("nothing");

        // then
        assertThat(products).isEmpty();
    }

    @Test
    @DisplayName("외부 서버 오류는 FoodCatalogException으로 변환된다")
    void search_UpstreamError() {
        // given
        server.expect(requestTo(BASE_URL + "/cgi/search.pl?search_terms=milk&json=true"))
                .andRespond(withServerError());

        // when & then
        assertThatThrownBy(() -> client.search("milk"))
                .isInstanceOf(FoodCatalogException.class)
                .hasMessageContaining("milk");
    }
}
