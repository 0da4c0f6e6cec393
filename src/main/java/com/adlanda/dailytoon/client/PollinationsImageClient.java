package com.adlanda.dailytoon.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Image generation over the Pollinations-style GET API:
 * {@code GET /prompt/{prompt}?width=&height=&seed=&nologo=true} returns the image bytes.
 */
@Component
public class PollinationsImageClient implements ImageGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(PollinationsImageClient.class);

    private final RestClient restClient;

    public PollinationsImageClient(@Qualifier("imageRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public byte[] generate(ImageRequest request) {
        ResponseEntity<byte[]> response;
        try {
            response = restClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/prompt/{prompt}")
                            .queryParam("width", request.width())
                            .queryParam("height", request.height())
                            .queryParam("seed", request.seed())
                            .queryParam("nologo", true)
                            .build(request.prompt()))
                    .retrieve()
                    .toEntity(byte[].class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("Image service returned {}", status);
            throw new ImageGenerationException(status, "Image service returned " + status, e);
        } catch (ResourceAccessException e) {
            log.warn("Image service unreachable: {}", e.getMessage());
            throw new ImageGenerationException(ImageGenerationException.NETWORK_ERROR,
                    "Image service unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.warn("Unusable response from image service: {}", e.getMessage());
            throw new ImageGenerationException(ImageGenerationException.NETWORK_ERROR,
                    "Unusable response from image service: " + e.getMessage(), e);
        }

        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            throw new ImageGenerationException(response.getStatusCode().value(), "Image service returned an empty payload");
        }

        MediaType contentType = response.getHeaders().getContentType();
        if (contentType != null && !"image".equals(contentType.getType())) {
            throw new ImageGenerationException(response.getStatusCode().value(),
                    "Image service returned " + contentType + " instead of an image");
        }

        log.debug("Received {} bytes from image service (seed {})", body.length, request.seed());
        return body;
    }
}
