package com.ryuqq.netexec.adapter.runner;

import com.ryuqq.netexec.adapter.inmemory.workspace.InMemoryWorkspace;
import com.ryuqq.netexec.application.net.Net;
import com.ryuqq.netexec.application.net.NetFactory;
import com.ryuqq.netexec.core.model.NetDefinition;
import com.ryuqq.netexec.core.model.OperatorDescriptor;
import com.ryuqq.netexec.core.outcome.Fail;
import com.ryuqq.netexec.core.outcome.Ok;
import com.ryuqq.netexec.core.outcome.Outcome;
import com.ryuqq.netexec.testkit.operator.TestOperators;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * NetTypes 통합 테스트 (NetFactory → Net → 실행자).
 *
 * @author NetExec Team
 * @since 1.0.0
 */
class NetTypesTest {

    private final NetFactory factory = NetTypes.newNetFactory(TestOperators.registry());

    @Test
    void dag와_simple_타입이_등록됨() {
        assertThat(factory.supportedTypes()).containsExactly(NetTypes.DAG, NetTypes.SIMPLE);
    }

    @Test
    void 같은_Net을_여러_번_실행할_수_있음() {
        // given
        InMemoryWorkspace workspace = new InMemoryWorkspace();
        workspace.putBlob("X", "x");
        Net net = factory.create(new NetDefinition("twice", NetTypes.DAG, 2, List.of(
            TestOperators.compute(OperatorDescriptor.of("inc", List.of("X"), List.of("X")))
        )), workspace);

        // when
        Outcome first = net.run();
        Outcome second = net.run();

        // then
        assertThat(first).isEqualTo(Ok.of(1));
        assertThat(second).isEqualTo(Ok.of(1));
        assertThat(workspace.getBlob("X")).isEqualTo("inc(inc(x))");
    }

    @Test
    void 실패하는_Operator가_있으면_두_타입_모두_같은_Fail을_반환함() {
        for (String type : List.of(NetTypes.DAG, NetTypes.SIMPLE)) {
            // given
            InMemoryWorkspace workspace = new InMemoryWorkspace();
            Net net = factory.create(new NetDefinition("broken", type, 2, List.of(
                TestOperators.compute(OperatorDescriptor.of("a", List.of(), List.of("A"))),
                TestOperators.fail(OperatorDescriptor.of("b", List.of("A"), List.of("B"))),
                TestOperators.compute(OperatorDescriptor.of("c", List.of("B"), List.of("C")))
            )), workspace);

            // when
            Outcome outcome = net.run();

            // then
            assertThat(outcome).as(type).isInstanceOf(Fail.class);
            assertThat(((Fail) outcome).failedOperators()).as(type).containsExactly("b");
            assertThat(workspace.hasBlob("A")).as(type).isTrue();
            assertThat(workspace.hasBlob("C")).as(type).isFalse();
        }
    }

    @Test
    void baseConfig가_null이면_IllegalArgumentException() {
        assertThatThrownBy(() -> NetTypes.newNetFactory(TestOperators.registry(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseConfig cannot be null");
    }
}
