package dcc.quoteme.lambda.service;

import dcc.quoteme.lambda.TestEvents;
import dcc.quoteme.lambda.model.OAuthSuccessFlag;
import dcc.quoteme.lambda.repository.QuoteRepository;
import dcc.quoteme.lambda.util.MockTimeProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class OAuthServiceTest {
    static final String KEY = "oauth_success_1700000000_12345678";

    @Mock
    QuoteRepository quoteRepositoryMock;

    OAuthService service;

    @BeforeEach
    void setUp() {
        service = new OAuthService(quoteRepositoryMock, new MockTimeProvider(1_700_000_000_123L));
    }

    @Test
    public void recordSuccess_ShouldStoreFlagKeyedByTimeAndSubject() {
        // Arrange
        String idToken = TestEvents.token("user-sub-12345678", "user@example.com", "user", null);

        // Act
        String key = service.recordSuccess(idToken);

        // Assert
        Assertions.assertEquals(KEY, key);
        ArgumentCaptor<OAuthSuccessFlag> captor = ArgumentCaptor.forClass(OAuthSuccessFlag.class);
        verify(quoteRepositoryMock).saveOAuthSuccessFlag(captor.capture(), eq(1_700_000_000L));
        Assertions.assertEquals("user@example.com", captor.getValue().getUserEmail());
        Assertions.assertEquals("user-sub-12345678", captor.getValue().getUserSub());
    }

    @Test
    public void recordSuccess_StorageFails_ShouldReturnEmptyKey() {
        doThrow(new RuntimeException("DynamoDB unavailable")).when(quoteRepositoryMock).saveOAuthSuccessFlag(any(), anyLong());

        String key = service.recordSuccess(TestEvents.token("sub", "user@example.com", "user", null));

        Assertions.assertEquals("", key);
    }

    @Test
    public void consumeSuccess_ValidFlag_ShouldReturnUserAndDeleteFlag() {
        when(quoteRepositoryMock.findOAuthSuccessFlag(KEY))
                .thenReturn(new OAuthSuccessFlag(KEY, OAuthSuccessFlag.TOKEN_TYPE, "user@example.com", "user-sub-12345678"));

        Map<String, Object> result = service.consumeSuccess(KEY);

        Assertions.assertEquals(true, result.get("success"));
        Assertions.assertEquals("user@example.com", result.get("user_email"));
        verify(quoteRepositoryMock).delete(KEY);
    }

    @Test
    public void consumeSuccess_MissingKey_ShouldFailWithoutLookup() {
        Map<String, Object> result = service.consumeSuccess("");

        Assertions.assertEquals(false, result.get("success"));
        Assertions.assertEquals("Missing success key", result.get("error"));
        verifyNoInteractions(quoteRepositoryMock);
    }

    @Test
    public void consumeSuccess_UnknownKey_ShouldReportExpired() {
        when(quoteRepositoryMock.findOAuthSuccessFlag(KEY)).thenReturn(null);

        Map<String, Object> result = service.consumeSuccess(KEY);

        Assertions.assertEquals("Success flag not found or expired", result.get("error"));
        verify(quoteRepositoryMock, never()).delete(anyString());
    }

    @Test
    public void consumeSuccess_WrongFlagType_ShouldReject() {
        when(quoteRepositoryMock.findOAuthSuccessFlag(KEY))
                .thenReturn(new OAuthSuccessFlag(KEY, "something_else", "user@example.com", "sub"));

        Assertions.assertEquals("Invalid flag type", service.consumeSuccess(KEY).get("error"));
    }
}
