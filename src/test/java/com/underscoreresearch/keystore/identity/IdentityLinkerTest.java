package com.underscoreresearch.keystore.identity;

import static com.underscoreresearch.keystore.utils.EncodingUtils.encodeHex;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.underscoreresearch.keystore.keys.KeyHandle;
import com.underscoreresearch.keystore.keys.SignatureSchemes;
import com.underscoreresearch.keystore.keys.Signer;

class IdentityLinkerTest {
    private ProofService github;
    private IdentityLinker linker;
    private ServiceIdentifier alice;

    @BeforeEach
    public void setup() throws ServiceParseException {
        github = mock(ProofService.class);
        when(github.getService()).thenReturn(Service.GITHUB);
        linker = new IdentityLinker(Set.of(github));
        alice = ServiceIdentifier.parse("alice@github");
    }

    @Test
    public void testDispatch() throws IOException {
        when(github.verify("alice", "sig")).thenReturn("account");
        when(github.resolve("alice")).thenReturn(List.of("account", "other"));
        when(github.proof("alice", "account", "object", "sig")).thenReturn("proof text");

        assertThat(linker.supports(Service.GITHUB), Is.is(true));
        assertThat(linker.verify(alice, "sig"), Is.is("account"));
        assertThat(linker.resolve(alice), Is.is(List.of("account", "other")));
        assertThat(linker.proof(alice, "account", "object", "sig"), Is.is("proof text"));
    }

    @Test
    public void testProveSignsObject() throws Exception {
        Signer signer = KeyHandle.fromSuri(SignatureSchemes.ED25519.getScheme(), "//Alice").toSigner();
        when(github.proof(eq("alice"), anyString(), anyString(), anyString())).thenReturn("proof");

        assertThat(linker.prove(alice, signer, "claim"), Is.is("proof"));

        ArgumentCaptor<String> signature = ArgumentCaptor.forClass(String.class);
        verify(github).proof(eq("alice"), eq(signer.getAccountId().toString()), eq("claim"), signature.capture());
        assertThat(encodeHex(signer.sign("claim".getBytes(StandardCharsets.UTF_8))), Is.is(signature.getValue()));
    }

    @Test
    public void testTransportFailurePropagates() throws IOException {
        when(github.resolve("alice")).thenThrow(new IOException("offline"));
        assertThrows(IOException.class, () -> linker.resolve(alice));
    }

    @Test
    public void testMissingService() {
        IdentityLinker empty = new IdentityLinker(Collections.emptySet());
        assertThat(empty.supports(Service.GITHUB), Is.is(false));
        assertThrows(IllegalStateException.class, () -> empty.verify(alice, "sig"));
    }

    @Test
    public void testDuplicateService() {
        ProofService other = mock(ProofService.class);
        when(other.getService()).thenReturn(Service.GITHUB);
        assertThrows(IllegalArgumentException.class, () -> new IdentityLinker(Set.of(github, other)));
    }
}
