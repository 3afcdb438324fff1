package com.task4ge.api.auth;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class JwtAuthFilterTest {

  private final JwtAuthFilter filter = new JwtAuthFilter(
      new JwtService(new AuthProperties(null, null, null, "filter-test-secret")));

  @Test
  void apiDocsAndStatusArePublic() throws Exception {
    for (String path : new String[]{"/v3/api-docs", "/v3/api-docs/swagger-config", "/swagger-ui/index.html", "/status"}) {
      MockHttpServletResponse response = new MockHttpServletResponse();
      MockFilterChain chain = new MockFilterChain();

      filter.doFilter(new MockHttpServletRequest("GET", path), response, chain);

      assertThat(chain.getRequest()).as(path).isNotNull();
      assertThat(response.getStatus()).as(path).isEqualTo(200);
    }
  }

  @Test
  void taskRoutesRequireToken() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(new MockHttpServletRequest("GET", "/task/getAll"), response, chain);

    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(chain.getRequest()).isNull();
  }
}
