package com.numaansystems.obo.service;

import com.numaansystems.obo.config.OboProperties;
import com.numaansystems.obo.model.AuthorizationFilter;
import com.numaansystems.obo.model.EmptyGroupsPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the OData security filter that restricts search results to documents
 * shared with one of the user's groups.
 *
 * <p>For groups {@code g1, g2} and the default field the filter reads:</p>
 * <pre>
 * security_groups/any(g: g eq 'g1' or g eq 'g2')
 * </pre>
 *
 * <h2>Users without groups</h2>
 * <p>Controlled by {@code obo.search.filter.empty-groups-policy}.
 * {@link EmptyGroupsPolicy#SHOW_ALL} applies no filter at all (fail-open);
 * {@link EmptyGroupsPolicy#SHOW_NONE} applies the constant filter
 * {@code false}.</p>
 *
 * <h2>Quotes in group ids</h2>
 * <p>Group ids are placed inside OData string literals. An id containing a
 * single quote could close the literal and inject filter syntax. Entra ID
 * object ids are GUIDs and never contain quotes, but the value comes from an
 * unverified token. Every such id is logged, and when
 * {@code obo.search.filter.escape-quotes} is enabled the quote is doubled as
 * OData requires. With escaping disabled the id is used as-is.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class AuthorizationFilterBuilder {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizationFilterBuilder.class);

    static final String DENY_ALL = "false";

    private final OboProperties.Filter settings;

    public AuthorizationFilterBuilder(OboProperties properties) {
        this.settings = properties.search().filter();
    }

    /**
     * Builds the filter for the given group ids.
     *
     * @param groups group object ids from the user's token, may be empty; repeated ids yield one clause
     * @return the filter and a description of the policy applied
     */
    public AuthorizationFilter buildFilter(Collection<String> groups) {
        if (groups == null || groups.isEmpty()) {
            return emptyGroupsFilter();
        }

        List<String> distinctGroups = groups.stream().distinct().collect(Collectors.toList());
        String clauses = distinctGroups.stream()
                .map(group -> "g eq '" + literal(group) + "'")
                .collect(Collectors.joining(" or "));
        String expression = settings.field() + "/any(g: " + clauses + ")";
        String description = String.format(
                "User can see documents where %s contains one of their %d group(s)",
                settings.field(), distinctGroups.size());

        logger.debug("Built security filter over {} group(s): {}", distinctGroups.size(), expression);
        return new AuthorizationFilter(expression, description);
    }

    private AuthorizationFilter emptyGroupsFilter() {
        if (settings.emptyGroupsPolicy() == EmptyGroupsPolicy.SHOW_NONE) {
            logger.debug("User has no groups, applying deny-all filter");
            return new AuthorizationFilter(DENY_ALL,
                    "User has no groups, showing no documents (deny-all security filter)");
        }
        logger.debug("User has no groups, no security filter applied");
        return AuthorizationFilter.unrestricted("User has no groups, showing all documents (no security filter)");
    }

    private String literal(String group) {
        if (group.indexOf('\'') < 0) {
            return group;
        }
        if (settings.escapeQuotes()) {
            logger.warn("Group id contains a quote character and was escaped before filtering: {}", group);
            return group.replace("'", "''");
        }
        logger.warn("Group id contains a quote character and is used unescaped in the filter: {}", group);
        return group;
    }
}
