package org.imageintensity;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Uszkodzony multipart i za duży plik sprawdzane na prawdziwym Tomcacie, bo MockMvc nie parsuje ramek multipart.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "server.tomcat.max-swallow-size=-1"
)
class MultipartUploadLimitsTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void unterminatedMultipartBodyIsBadRequest() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType("multipart/form-data; boundary=XYZ"));
        String body = "--XYZ\r\n"
                + "Content-Disposition: form-data; name=\"image\"; filename=\"a.png\"\r\n"
                + "Content-Type: image/png\r\n\r\n"
                + "abc";

        ResponseEntity<String> response = restTemplate.exchange("/calculate-intensity", HttpMethod.POST,
                new HttpEntity<>(body.getBytes(StandardCharsets.US_ASCII), headers), String.class);

        assertEquals(400, response.getStatusCode().value());
        assertNotNull(response.getBody());
        assertTrue(response.getBody().contains("\"error\""), response.getBody());
    }

    @Test
    void uploadOverSizeLimitIsBadRequest() {
        // 21MB przy limicie 20MB
        ByteArrayResource tooLarge = new ByteArrayResource(new byte[21 * 1024 * 1024]) {
            @Override
            public String getFilename() {
                return "big.png";
            }
        };
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("image", tooLarge);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        ResponseEntity<String> response = restTemplate.postForEntity("/calculate-intensity",
                new HttpEntity<>(parts, headers), String.class);

        assertEquals(400, response.getStatusCode().value());
        assertNotNull(response.getBody());
        assertTrue(response.getBody().contains("\"error\""), response.getBody());
    }

    @Test
    void validUploadSucceedsOverRealConnection() {
        ByteArrayResource png = new ByteArrayResource(TestImages.png(TestImages.uniform(4, 4, 0x5A5A5A))) {
            @Override
            public String getFilename() {
                return "gray.png";
            }
        };
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("image", png);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        ResponseEntity<String> response = restTemplate.postForEntity("/calculate-intensity",
                new HttpEntity<>(parts, headers), String.class);

        assertEquals(200, response.getStatusCode().value());
        assertTrue(response.getBody().contains("\"average_intensity\":90.0"), response.getBody());
    }
}
