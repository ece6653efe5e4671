package io.routedoc.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PathTemplate")
class PathTemplateTest {

    @Test
    void rootRendersAsSlash() {
        assertThat(PathTemplate.root().render()).isEqualTo("/");
        assertThat(PathTemplate.parse("///")).isEqualTo(PathTemplate.root());
    }

    @Test
    void parseAndRenderAreInverse() {
        PathTemplate path = PathTemplate.parse("/users/{user_id}/posts");

        assertThat(path.render()).isEqualTo("/users/{user_id}/posts");
        assertThat(path.captureNames()).containsExactly("user_id");
        assertThat(path.segments()).hasSize(3);
    }

    @Test
    @DisplayName("captures compare positionally, whatever their names")
    void captureNamesDoNotAffectIdentity() {
        PathTemplate byId = PathTemplate.parse("/users/{id}");
        PathTemplate byUid = PathTemplate.parse("/users/{uid}");

        assertThat(byId).isEqualTo(byUid).hasSameHashCodeAs(byUid);
        assertThat(byId.sameCaptureNames(byUid)).isFalse();
        assertThat(byId).isNotEqualTo(PathTemplate.parse("/users/id"));
    }

    @Test
    void appendLeavesTheOriginalAlone() {
        PathTemplate users = PathTemplate.parse("/users");

        PathTemplate extended = users.append(new PathSegment.Capture("id"));

        assertThat(users.render()).isEqualTo("/users");
        assertThat(extended.render()).isEqualTo("/users/{id}");
    }
}
