package com.example.baldnessdetector.service.wallet;

import com.example.baldnessdetector.exception.UserNotFoundException;
import com.example.baldnessdetector.exception.WalletAlreadyAssignedException;
import com.example.baldnessdetector.exception.WalletProvisioningException;
import com.example.baldnessdetector.model.User;
import com.example.baldnessdetector.service.UserDirectoryService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WalletProvisionerTest {

    @Mock
    private UserDirectoryService userDirectoryService;
    @Mock
    private WalletProvider walletProvider;

    @InjectMocks
    private WalletProvisioner provisioner;

    @Test
    void assignsNewWallet() {
        User user = User.builder().id(1L).email("a@example.com").name("A").build();
        when(userDirectoryService.getById(1L)).thenReturn(user);
        when(walletProvider.createWallet(1L)).thenReturn("0xabc");

        assertThat(provisioner.provisionOnce(1L)).isEqualTo(ProvisioningOutcome.ASSIGNED);
        verify(userDirectoryService).updateWalletAddress(1L, "0xabc");
    }

    @Test
    void skipsUserThatAlreadyHasWallet() {
        User user = User.builder().id(1L).email("a@example.com").name("A").walletAddress("0xold").build();
        when(userDirectoryService.getById(1L)).thenReturn(user);

        assertThat(provisioner.provisionOnce(1L)).isEqualTo(ProvisioningOutcome.SKIPPED);
        verify(walletProvider, never()).createWallet(anyLong());
    }

    @Test
    void keepsWalletAssignedConcurrently() {
        User user = User.builder().id(1L).email("a@example.com").name("A").build();
        when(userDirectoryService.getById(1L)).thenReturn(user);
        when(walletProvider.createWallet(1L)).thenReturn("0xnew");
        when(userDirectoryService.updateWalletAddress(1L, "0xnew"))
                .thenThrow(new WalletAlreadyAssignedException(1L, "0xfirst"));

        assertThat(provisioner.provisionOnce(1L)).isEqualTo(ProvisioningOutcome.SKIPPED);
    }

    @Test
    void reportsMissingUser() {
        when(userDirectoryService.getById(2L)).thenThrow(UserNotFoundException.byId(2L));

        assertThat(provisioner.provisionOnce(2L)).isEqualTo(ProvisioningOutcome.USER_MISSING);
        verify(walletProvider, never()).createWallet(anyLong());
    }

    @Test
    void propagatesProviderFailure() {
        User user = User.builder().id(1L).email("a@example.com").name("A").build();
        when(userDirectoryService.getById(1L)).thenReturn(user);
        when(walletProvider.createWallet(1L)).thenThrow(new WalletProvisioningException("down"));

        assertThatThrownBy(() -> provisioner.provisionOnce(1L)).isInstanceOf(WalletProvisioningException.class);
        verify(userDirectoryService, never()).updateWalletAddress(anyLong(), anyString());
    }
}
