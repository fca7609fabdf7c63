package de.htwsaar.assetguard.web.headers;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.assetguard.web.route.RouteClass;
import de.htwsaar.assetguard.web.route.RouteClassifier;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class LegacyHeaderStripperTest {

    private final LegacyHeaderStripper stripper = new LegacyHeaderStripper(new RouteClassifier());

    @Test
    void acceptFollowsContentNegotiation() {
        assertTrue(LegacyHeaderStripper.acceptsHtml("text/html,application/xhtml+xml;q=0.9,*/*;q=0.8"));
        assertTrue(LegacyHeaderStripper.acceptsHtml("application/xhtml+xml"));
        assertTrue(LegacyHeaderStripper.acceptsHtml("TEXT/HTML; charset=utf-8"));
        assertTrue(LegacyHeaderStripper.acceptsHtml("*/*"));
        assertTrue(LegacyHeaderStripper.acceptsHtml("text/*;q=0.5"));
        assertTrue(LegacyHeaderStripper.acceptsHtml(null));
        assertTrue(LegacyHeaderStripper.acceptsHtml(""));
        assertFalse(LegacyHeaderStripper.acceptsHtml("application/json"));
        assertFalse(LegacyHeaderStripper.acceptsHtml("text/html;q=0"));
        assertFalse(LegacyHeaderStripper.acceptsHtml("*/*;q=0"));
        assertFalse(LegacyHeaderStripper.acceptsHtml("text/html;q=0, */*"));
        assertTrue(LegacyHeaderStripper.acceptsHtml("text/plain;q=0, */*"));
    }

    @Test
    void anyHtmlSignalIsEnough() {
        assertTrue(stripper.isHtmlResponse(null, null, RouteClass.HTML_PAGE));
        assertTrue(stripper.isHtmlResponse(null, "text/html;charset=UTF-8", RouteClass.API));
        assertTrue(stripper.isHtmlResponse("text/html", "application/json", RouteClass.API));
        assertFalse(stripper.isHtmlResponse("application/json", "application/json", RouteClass.API));
        assertFalse(stripper.isHtmlResponse("text/css", "text/css", RouteClass.STATIC_ASSET));
        assertTrue(stripper.isHtmlResponse(null, "application/json", RouteClass.API));
    }

    @Test
    void stripsHeadersSetByInnerLayersFromHtmlResponses() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/report");
        MockHttpServletResponse response = new MockHttpServletResponse();

        new HeaderGuardFilter(stripper).doFilter(request, response, new MockFilterChain(new HeaderWritingServlet("text/html")));

        for (String h : LegacyHeaderStripper.LEGACY_HEADERS) {
            assertFalse(response.containsHeader(h), h);
        }
        assertEquals("nosniff", response.getHeader("X-Content-Type-Options"));
    }

    @Test
    void keepsHeadersOnNonHtmlResponses() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/report");
        request.addHeader("Accept", "application/json");
        MockHttpServletResponse response = new MockHttpServletResponse();

        new HeaderGuardFilter(stripper).doFilter(request, response,
                new MockFilterChain(new HeaderWritingServlet("application/json")));

        assertEquals("0", response.getHeader("X-XSS-Protection"));
        assertEquals("off", response.getHeader("X-DNS-Prefetch-Control"));
        assertEquals("none", response.getHeader("X-Permitted-Cross-Domain-Policies"));
    }

    @Test
    void wildcardAcceptStripsHeadersOnApiResponses() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/report");
        request.addHeader("Accept", "*/*");
        MockHttpServletResponse response = new MockHttpServletResponse();

        new HeaderGuardFilter(stripper).doFilter(request, response,
                new MockFilterChain(new HeaderWritingServlet("application/json")));

        assertFalse(response.containsHeader("X-XSS-Protection"));
        assertEquals("nosniff", response.getHeader("X-Content-Type-Options"));
    }

    /** Setzt Security-Header und schreibt danach den Body. */
    private static final class HeaderWritingServlet extends HttpServlet {

        private final String contentType;

        HeaderWritingServlet(String contentType) {
            this.contentType = contentType;
        }

        @Override
        protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            SecurityHeadersFilter.DEFAULT_HEADERS.forEach(resp::setHeader);
            resp.setContentType(contentType);
            resp.getWriter().write("body");
        }
    }
}
