package com.flamingo.ai.regdocs.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.regdocs.exception.InvalidSubstanceNameException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("SubstanceQuery")
class SubstanceQueryTest {

  @Test
  void shouldStripSaltSuffix_andDeriveSlug() {
    SubstanceQuery query = SubstanceQuery.of("Ibuprofen HCL");

    assertThat(query.rawName()).isEqualTo("Ibuprofen HCL");
    assertThat(query.normalizedName()).isEqualTo("Ibuprofen");
    assertThat(query.slug()).isEqualTo("ibuprofen");
  }

  @ParameterizedTest
  @CsvSource({
    "'  Metformin hydrochloride  ', Metformin, metformin",
    "Morphine Sulfate, Morphine, morphine",
    "Diclofenac sodium, Diclofenac, diclofenac",
    "Losartan Potassium, Losartan, losartan",
    "Acetylsalicylic acid, Acetylsalicylic acid, acetylsalicylic-acid",
    "'Co-amoxiclav (oral)', Co-amoxiclav (oral), co-amoxiclav-oral"
  })
  void shouldNormalizeNames(String raw, String normalized, String slug) {
    SubstanceQuery query = SubstanceQuery.of(raw);

    assertThat(query.normalizedName()).isEqualTo(normalized);
    assertThat(query.slug()).isEqualTo(slug);
  }

  @Test
  void shouldBeIdempotent_whenNormalizingTwice() {
    SubstanceQuery first = SubstanceQuery.of("Ibuprofen HCL");
    SubstanceQuery second = SubstanceQuery.of(first.normalizedName());

    assertThat(second.normalizedName()).isEqualTo(first.normalizedName());
    assertThat(second.slug()).isEqualTo(first.slug());
  }

  @Test
  void shouldKeepSuffix_whenItIsNotASeparateWord() {
    assertThat(SubstanceQuery.of("Potassium").normalizedName()).isEqualTo("Potassium");
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "   ", "!!!", "--"})
  void shouldReject_whenNameHasNoUsableCharacters(String raw) {
    assertThatThrownBy(() -> SubstanceQuery.of(raw))
        .isInstanceOf(InvalidSubstanceNameException.class);
  }

  @Test
  void shouldReject_whenNameIsNull() {
    assertThatThrownBy(() -> SubstanceQuery.of(null))
        .isInstanceOf(InvalidSubstanceNameException.class);
  }
}
