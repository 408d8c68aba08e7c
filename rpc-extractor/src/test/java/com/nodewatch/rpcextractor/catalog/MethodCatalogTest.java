package com.nodewatch.rpcextractor.catalog;

import com.nodewatch.rpcextractor.common.ExtractorConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MethodCatalogTest {

    @Test
    @DisplayName("all known methods are enabled when nothing is disabled, in declaration order")
    void fromDisabled_empty_enablesAll() {
        MethodCatalog catalog = MethodCatalog.fromDisabled(List.of());

        assertThat(catalog.methods()).extracting(RpcMethodSpec::name).containsExactly(
                "getpeerinfo", "getmempoolinfo", "uptime", "getnettotals", "getmemoryinfo",
                "getaddrmaninfo", "getchaintxstats", "getnetworkinfo", "getblockchaininfo");
        assertThat(catalog.enabledMethods()).hasSize(9);
    }

    @Test
    @DisplayName("disable switches turn off exactly the named methods, case-insensitively")
    void fromDisabled_namedMethods_areDisabled() {
        MethodCatalog catalog = MethodCatalog.fromDisabled(List.of("getpeerinfo", " UPTIME "));

        assertThat(catalog.find("getpeerinfo")).get().extracting(RpcMethodSpec::enabled).isEqualTo(false);
        assertThat(catalog.find("uptime")).get().extracting(RpcMethodSpec::enabled).isEqualTo(false);
        assertThat(catalog.enabledMethods()).extracting(RpcMethodSpec::name)
                .doesNotContain("getpeerinfo", "uptime")
                .hasSize(7);
        assertThat(catalog.size()).isEqualTo(9);
    }

    @Test
    @DisplayName("expensive chain statistics fire less often than cheap calls")
    void cadence_expensiveMethodsHaveMultiplier() {
        MethodCatalog catalog = MethodCatalog.fromDisabled(null);

        assertThat(catalog.find("getchaintxstats")).get().extracting(RpcMethodSpec::cadenceMultiplier).isEqualTo(10);
        assertThat(catalog.find("getblockchaininfo")).get().extracting(RpcMethodSpec::cadenceMultiplier).isEqualTo(10);
        assertThat(catalog.find("uptime")).get().extracting(RpcMethodSpec::cadenceMultiplier).isEqualTo(1);
    }

    @Test
    void fromDisabled_unknownMethod_throwsConfigError() {
        assertThatThrownBy(() -> MethodCatalog.fromDisabled(List.of("getblock")))
                .isInstanceOf(ExtractorConfigException.class)
                .hasMessageContaining("getblock");
    }

    @Test
    void constructor_duplicateNames_throws() {
        assertThatThrownBy(() -> new MethodCatalog(List.of(
                new RpcMethodSpec("uptime", true, 1),
                new RpcMethodSpec("uptime", false, 1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void methodSpec_rejectsZeroMultiplier() {
        assertThatThrownBy(() -> new RpcMethodSpec("uptime", true, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void methods_isUnmodifiable() {
        MethodCatalog catalog = MethodCatalog.fromDisabled(List.of());
        assertThatThrownBy(() -> catalog.methods().add(new RpcMethodSpec("x", true, 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void fromRpcName_unknown_isEmpty() {
        assertThat(RpcMethod.fromRpcName("nope")).isEmpty();
        assertThat(RpcMethod.fromRpcName(null)).isEmpty();
        assertThat(RpcMethod.fromRpcName("getnettotals")).contains(RpcMethod.GETNETTOTALS);
    }
}
