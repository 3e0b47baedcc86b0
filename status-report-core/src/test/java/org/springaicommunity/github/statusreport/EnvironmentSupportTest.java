package org.springaicommunity.github.statusreport;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EnvironmentSupport Tests")
class EnvironmentSupportTest {

	private final Map<String, String> variables = Map.of("GITHUB_TOKEN", "ghp_abc", "ORG", "xmidt-org",
			"DOLLAR", "$1\\");

	@Test
	@DisplayName("Should replace known placeholders")
	void shouldReplacePlaceholders() {
		assertThat(EnvironmentSupport.expand("${GITHUB_TOKEN}", variables::get)).isEqualTo("ghp_abc");
		assertThat(EnvironmentSupport.expand("https://github.com/${ORG}/${ORG}", variables::get))
			.isEqualTo("https://github.com/xmidt-org/xmidt-org");
	}

	@Test
	@DisplayName("Should expand unknown variables to the empty string")
	void shouldExpandUnknownToEmpty() {
		assertThat(EnvironmentSupport.expand("a${MISSING}b", variables::get)).isEqualTo("ab");
	}

	@Test
	@DisplayName("Should keep replacement text literally")
	void shouldKeepReplacementLiteral() {
		assertThat(EnvironmentSupport.expand("${DOLLAR}", variables::get)).isEqualTo("$1\\");
	}

	@Test
	@DisplayName("Should leave text without placeholders alone")
	void shouldLeavePlainText() {
		assertThat(EnvironmentSupport.expand("$HOME {x} ${not valid}", variables::get))
			.isEqualTo("$HOME {x} ${not valid}");
	}

}
