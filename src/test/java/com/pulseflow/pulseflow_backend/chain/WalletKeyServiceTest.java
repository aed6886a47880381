package com.pulseflow.pulseflow_backend.chain;

import com.pulseflow.pulseflow_backend.config.ChainProperties;
import com.pulseflow.pulseflow_backend.exception.ChainAdapterException;
import com.pulseflow.pulseflow_backend.model.domain.Workflow;
import com.pulseflow.pulseflow_backend.repository.WorkflowRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.web3j.crypto.Credentials;

import java.math.BigInteger;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WalletKeyServiceTest {

    private static final String PRIVATE_KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";

    @Mock
    private WorkflowRepository workflowRepository;

    private static ChainProperties properties(String password) {
        return new ChainProperties("http://localhost:8545", 369L, "0xautomation", "0xrouter", FakeChainAdapter.WPLS,
                BigInteger.TEN, 120, 10L, 3, 1200L, password);
    }

    @Test
    void encryptedKeyDecryptsToCredentials() {
        WalletKeyService service = new WalletKeyService(workflowRepository, properties("correct horse"));
        String stored = service.encrypt(PRIVATE_KEY);

        UUID id = UUID.randomUUID();
        Workflow workflow = new Workflow();
        workflow.setId(id);
        workflow.setWalletEncKey(stored);
        when(workflowRepository.findById(id)).thenReturn(Optional.of(workflow));

        Credentials credentials = service.credentials(id.toString());

        assertThat(credentials.getAddress()).isEqualTo(Credentials.create(PRIVATE_KEY).getAddress());
        // salt + iv + tag + 66 bytes of "0x..." plaintext
        assertThat(stored).hasSize(2 * (16 + 16 + 16 + 66));
    }

    @Test
    void wrongPasswordCannotDecrypt() {
        String stored = new WalletKeyService(workflowRepository, properties("correct horse")).encrypt(PRIVATE_KEY);
        WalletKeyService other = new WalletKeyService(workflowRepository, properties("battery staple"));

        assertThatThrownBy(() -> other.decrypt(stored))
                .isInstanceOf(ChainAdapterException.class)
                .hasMessage("Could not decrypt wallet key");
    }

    @Test
    void missingPasswordIsReported() {
        WalletKeyService service = new WalletKeyService(workflowRepository, properties(""));

        assertThatThrownBy(() -> service.decrypt("00".repeat(64)))
                .isInstanceOf(ChainAdapterException.class)
                .hasMessageContaining("password is not configured");
    }

    @Test
    void unknownWorkflowIsReported() {
        UUID id = UUID.randomUUID();
        when(workflowRepository.findById(id)).thenReturn(Optional.empty());
        WalletKeyService service = new WalletKeyService(workflowRepository, properties("pw"));

        assertThatThrownBy(() -> service.walletAddress(id.toString()))
                .isInstanceOf(ChainAdapterException.class)
                .hasMessageContaining("not found");
    }
}
