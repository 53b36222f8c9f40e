package com.numaansystems.obo.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.obo.config.OboProperties;
import com.numaansystems.obo.exception.DownstreamException;
import com.numaansystems.obo.exception.TransportException;
import com.numaansystems.obo.model.UserProfile;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.HttpHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Calls Microsoft Graph with an OBO token issued for Graph scopes.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>{@code GET /me} - profile of the signed-in user</li>
 *   <li>{@code GET /me/memberOf} - directory objects the user belongs to</li>
 * </ul>
 *
 * <p>Graph tokens never carry a {@code groups} claim, so group membership has
 * to be read from {@code /me/memberOf}. That collection also contains
 * directory roles and administrative units; only entries typed
 * {@code #microsoft.graph.group} are kept.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class GraphClient {

    private static final Logger logger = LoggerFactory.getLogger(GraphClient.class);

    static final String GROUP_TYPE = "#microsoft.graph.group";
    static final String ODATA_TYPE = "@odata.type";
    static final String ODATA_NEXT_LINK = "@odata.nextLink";

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final OboProperties.Graph graph;

    public GraphClient(CloseableHttpClient httpClient, ObjectMapper objectMapper, OboProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.graph = properties.graph();
    }

    /**
     * Reads the signed-in user's profile.
     *
     * @param accessToken OBO token for Graph
     * @return the user's profile
     * @throws DownstreamException if Graph answers with a non-200 status
     * @throws TransportException if Graph cannot be reached or returns unreadable JSON
     */
    public UserProfile fetchProfile(String accessToken) {
        DownstreamResponse response = get(graph.baseUrl() + "/me", accessToken);
        if (!response.isOk()) {
            logger.warn("Microsoft Graph /me returned HTTP {}", response.status());
            throw new DownstreamException("Failed to call Microsoft Graph", response.status(), response.body(),
                    suggestionFor(response.status()));
        }
        try {
            return objectMapper.readValue(response.body(), UserProfile.class);
        } catch (JsonProcessingException e) {
            throw new TransportException("Microsoft Graph returned an unreadable profile", e);
        }
    }

    /**
     * Lists the ids of the groups the user is a direct member of.
     *
     * <p>Follows {@code @odata.nextLink} up to {@code obo.graph.max-membership-pages}
     * pages. A non-200 answer, usually a missing {@code GroupMember.Read.All}
     * consent, is logged and ends the listing with the groups read so far.</p>
     *
     * @param accessToken OBO token for Graph
     * @return group object ids, never null
     */
    public List<String> fetchGroupMemberships(String accessToken) {
        List<String> groupIds = new ArrayList<>();
        String url = graph.baseUrl() + "/me/memberOf";
        int pages = 0;

        while (url != null && pages < graph.maxMembershipPages()) {
            DownstreamResponse response = get(url, accessToken);
            pages++;
            if (!response.isOk()) {
                logger.warn("Microsoft Graph /me/memberOf returned HTTP {}, group listing skipped", response.status());
                break;
            }
            JsonNode page = readTree(response.body());
            for (JsonNode entry : page.path("value")) {
                if (GROUP_TYPE.equals(entry.path(ODATA_TYPE).asText()) && entry.hasNonNull("id")) {
                    groupIds.add(entry.get("id").asText());
                }
            }
            url = page.hasNonNull(ODATA_NEXT_LINK) ? page.get(ODATA_NEXT_LINK).asText() : null;
        }

        if (url != null) {
            logger.info("Group listing truncated after {} page(s)", pages);
        }
        logger.debug("Read {} group membership(s) from Microsoft Graph", groupIds.size());
        return groupIds;
    }

    private DownstreamResponse get(String url, String accessToken) {
        HttpGet request = new HttpGet(url);
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
        request.setHeader(HttpHeaders.ACCEPT, "application/json");
        try {
            return httpClient.execute(request, DownstreamResponse::read);
        } catch (IOException e) {
            logger.error("Microsoft Graph call to {} failed: {}", url, e.getMessage());
            throw new TransportException("Microsoft Graph unreachable: " + e.getMessage(), e);
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransportException("Microsoft Graph returned unreadable JSON", e);
        }
    }

    private static String suggestionFor(int status) {
        if (status == 401 || status == 403) {
            return "Ensure the API registration has the delegated Microsoft Graph permission 'User.Read' "
                    + "and that admin or user consent was granted.";
        }
        return "HTTP " + status + " error from Microsoft Graph";
    }
}
