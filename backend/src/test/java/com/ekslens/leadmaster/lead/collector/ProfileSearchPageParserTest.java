package com.ekslens.leadmaster.lead.collector;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileSearchPageParserTest {
    private static final String BASE = "https://www.linkedin.com/search/results/people/?keywords=botox";

    private final ProfileSearchPageParser parser = new ProfileSearchPageParser();

    @Test
    void extractsCardsFromResultContainers() {
        String html = """
            <ul>
              <li class="reusable-search__result-container">
                <a href="https://www.linkedin.com/in/ana-ruiz-123/?miniProfileUrn=abc">
                  <span aria-hidden="true">Ana Ruiz</span>
                  <span class="visually-hidden">Ver el perfil de Ana Ruiz</span>
                </a>
                <div class="entity-result__primary-subtitle">Médico estético en Clínica Botox</div>
                <div class="entity-result__secondary-subtitle">Madrid</div>
              </li>
              <li class="reusable-search__result-container">
                <a href="/in/carlos-gil">Carlos Gil</a>
                <div class="entity-result__primary-subtitle">Dermatólogo</div>
              </li>
              <li class="reusable-search__result-container">
                <a href="https://www.linkedin.com/company/clinica-bella/">Clínica Bella</a>
              </li>
            </ul>
            """;

        List<ProfileCard> cards = parser.parse(html, BASE, 10);

        assertThat(cards).hasSize(2);
        ProfileCard ana = cards.get(0);
        assertThat(ana.name()).isEqualTo("Ana Ruiz");
        assertThat(ana.profileUrl()).isEqualTo("https://www.linkedin.com/in/ana-ruiz-123");
        assertThat(ana.headline()).isEqualTo("Médico estético en Clínica Botox");
        assertThat(ana.location()).isEqualTo("Madrid");
        assertThat(cards.get(1).profileUrl()).isEqualTo("https://www.linkedin.com/in/carlos-gil");
        assertThat(cards.get(1).location()).isNull();
    }

    @Test
    void fallsBackToBareProfileLinks() {
        String html = """
            <div>
              <a href="https://www.linkedin.com/in/lucia-mar/">Ver perfil</a>
              <a href="https://www.linkedin.com/in/lucia-mar/">Lucía Mar</a>
              <a href="https://www.linkedin.com/feed/">Inicio</a>
            </div>
            """;

        List<ProfileCard> cards = parser.parse(html, BASE, 10);

        assertThat(cards).extracting(ProfileCard::name).containsExactly("Lucía Mar");
        assertThat(cards.get(0).profileUrl()).isEqualTo("https://www.linkedin.com/in/lucia-mar");
    }

    @Test
    void honoursResultLimit() {
        StringBuilder html = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            html.append("<a href=\"https://www.linkedin.com/in/person-").append(i).append("\">Person ").append(i).append("</a>");
        }

        assertThat(parser.parse(html.toString(), BASE, 3)).hasSize(3);
    }

    @Test
    void emptyPageYieldsNoCards() {
        assertThat(parser.parse("", BASE, 5)).isEmpty();
        assertThat(parser.parse("<html><body>No results</body></html>", BASE, 5)).isEmpty();
    }

    @Test
    void profileUrlRecognition() {
        assertThat(ProfileSearchPageParser.isProfileUrl("https://www.linkedin.com/in/ana")).isTrue();
        assertThat(ProfileSearchPageParser.isProfileUrl("https://www.linkedin.com/in/ana/?trk=x")).isTrue();
        assertThat(ProfileSearchPageParser.isProfileUrl("https://www.linkedin.com/in/ana/detail/")).isFalse();
        assertThat(ProfileSearchPageParser.isProfileUrl("https://www.linkedin.com/company/acme")).isFalse();
    }
}
