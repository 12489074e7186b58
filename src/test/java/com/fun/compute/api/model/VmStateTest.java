package com.fun.compute.api.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VmStateTest {

    @Test
    void statusLookupIsCaseInsensitive() {
        assertThat(VmState.fromStatus("build")).contains(VmState.BUILDING);
        assertThat(VmState.fromStatus("RESCUE")).contains(VmState.RESCUED);
        assertThat(VmState.fromStatus("Deleted")).contains(VmState.DELETED);
        assertThat(VmState.fromStatus("bogus")).isEmpty();
    }

    @Test
    void taskStateRefinesActiveStatus() {
        assertThat(VmState.ACTIVE.statusFor(null)).isEqualTo("ACTIVE");
        assertThat(VmState.ACTIVE.statusFor("rebooting_hard")).isEqualTo("HARD_REBOOT");
        assertThat(VmState.ACTIVE.statusFor("resize_verify")).isEqualTo("VERIFY_RESIZE");
        assertThat(VmState.STOPPED.statusFor("rebooting")).isEqualTo("STOPPED");
    }

    @Test
    void rebootTypeParsingIgnoresCase() {
        assertThat(RebootType.parse("soft")).contains(RebootType.SOFT);
        assertThat(RebootType.parse("Hard")).contains(RebootType.HARD);
        assertThat(RebootType.parse("loud")).isEmpty();
        assertThat(RebootType.parse(null)).isEmpty();
    }

    @Test
    void actionKeysAreExact() {
        assertThat(ServerActionType.fromKey("createBackup")).contains(ServerActionType.CREATE_BACKUP);
        assertThat(ServerActionType.CREATE_BACKUP.adminApiOnly()).isTrue();
        assertThat(ServerActionType.fromKey("Reboot")).isEmpty();
    }
}
