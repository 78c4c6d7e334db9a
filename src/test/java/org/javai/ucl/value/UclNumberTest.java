package org.javai.ucl.value;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class UclNumberTest {

	@Test
	void integralValuesRenderWithoutFraction() {
		assertThat(UclNumber.of(5.0).toCanonicalString()).isEqualTo("5");
		assertThat(UclNumber.of(-42).toCanonicalString()).isEqualTo("-42");
		assertThat(UclNumber.of(0).toCanonicalString()).isEqualTo("0");
	}

	@Test
	void fractionalValuesRenderInPlainNotation() {
		assertThat(UclNumber.of(2.5).toCanonicalString()).isEqualTo("2.5");
		assertThat(UclNumber.of(0.0001).toCanonicalString()).isEqualTo("0.0001");
		assertThat(UclNumber.of(1e20).toCanonicalString()).isEqualTo("100000000000000000000");
	}

	@Test
	void negativeZeroEqualsZero() {
		assertThat(UclNumber.of(-0.0)).isEqualTo(UclNumber.of(0));
		assertThat(UclNumber.of(-0.0).toCanonicalString()).isEqualTo("0");
	}

	@Test
	void integralCheck() {
		assertThat(UclNumber.of(3).isIntegral()).isTrue();
		assertThat(UclNumber.of(3.5).isIntegral()).isFalse();
		assertThat(UclNumber.of(Double.POSITIVE_INFINITY).isIntegral()).isFalse();
	}

	@Test
	void toJavaIsDouble() {
		assertThat(UclNumber.of(7).toJava()).isEqualTo(7.0);
		assertThat(UclNumber.of(7)).hasToString("7");
	}
}
