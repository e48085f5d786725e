package com.cario.scholar.app.service.matching;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NameNormalizerTest {

  @Test
  void blankInputHasNoVariants() {
    assertThat(NameNormalizer.variants(null)).isEmpty();
    assertThat(NameNormalizer.variants("   ")).isEmpty();
  }

  @Test
  void parentheticalAliasAndAcronymAreVariants() {
    assertThat(NameNormalizer.variants("Massachusetts Institute of Technology (MIT)"))
        .contains("massachusettsinstituteoftechnologymit")
        .contains("massachusettsinstituteoftechnology", "mit");
  }

  @Test
  void departmentPrefixAndCommaSegmentsAreStripped() {
    assertThat(NameNormalizer.variants("Dept. of Computer Science, Stanford University"))
        .contains("computersciencestanforduniversity", "stanforduniversity", "deptofcomputerscience");
  }

  @Test
  void trailingSegmentsWithoutOrganizationKeywordAreDropped() {
    assertThat(NameNormalizer.variants("Zhejiang University, Hangzhou, China"))
        .contains("zhejianguniversity")
        .doesNotContain("china", "hangzhouchina");
  }

  @Test
  void abbreviationsAreExpanded() {
    assertThat(NameNormalizer.variants("Univ. of Tokyo")).contains("universityoftokyo");
  }

  @Test
  void leadingArticleIsStripped() {
    assertThat(NameNormalizer.variants("The Ohio State University"))
        .contains("theohiostateuniversity", "ohiostateuniversity");
  }

  @Test
  void acronymSkipsStopwordsAndDropsSingleLetters() {
    assertThat(NameNormalizer.acronym("Massachusetts Institute of Technology")).isEqualTo("mit");
    assertThat(NameNormalizer.acronym("University")).isEmpty();
  }

  @Test
  void variantsAreDeterministic() {
    String name = "Department of Computer Science, Zhejiang University";
    assertThat(NameNormalizer.variants(name))
        .containsExactlyElementsOf(NameNormalizer.variants(name));
  }

  @Test
  void organizationNamesAlwaysHaveVariants() {
    for (String s :
        new String[] {"Google Research", "Tsinghua University", "Max Planck Institute", "Acme Inc"}) {
      assertThat(NameNormalizer.variants(s)).as(s).isNotEmpty();
    }
  }

  @Test
  void foldKeepsLowercaseAlphanumerics() {
    assertThat(NameNormalizer.fold("ETH Zürich, D-INFK 2")).isEqualTo("ethzrichdinfk2");
    assertThat(NameNormalizer.fold(null)).isEmpty();
  }
}
