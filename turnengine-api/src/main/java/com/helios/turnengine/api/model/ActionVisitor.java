package com.helios.turnengine.api.model;

/**
 * Visitor over the closed {@link Action} vocabulary.
 *
 * @param <R> result type
 */
public interface ActionVisitor<R> {
    R visitShowMessage(Action.ShowMessage action);
    R visitNpcSays(Action.NpcSays action);
    R visitNpcSaysRandom(Action.NpcSaysRandom action);
    R visitSpinnerMessage(Action.SpinnerMessage action);
    R visitAwardPoints(Action.AwardPoints action);
    R visitAddFlag(Action.AddFlag action);
    R visitRemoveFlag(Action.RemoveFlag action);
    R visitAdvanceFlag(Action.AdvanceFlag action);
    R visitResetFlag(Action.ResetFlag action);
    R visitSpawnItemInRoom(Action.SpawnItemInRoom action);
    R visitSpawnItemCurrentRoom(Action.SpawnItemCurrentRoom action);
    R visitSpawnItemInInventory(Action.SpawnItemInInventory action);
    R visitSpawnItemInContainer(Action.SpawnItemInContainer action);
    R visitDespawnItem(Action.DespawnItem action);
    R visitReplaceItem(Action.ReplaceItem action);
    R visitSetItemDescription(Action.SetItemDescription action);
    R visitGiveItemToPlayer(Action.GiveItemToPlayer action);
    R visitSetContainerState(Action.SetContainerState action);
    R visitLockItem(Action.LockItem action);
    R visitUnlockItem(Action.UnlockItem action);
    R visitRevealExit(Action.RevealExit action);
    R visitLockExit(Action.LockExit action);
    R visitUnlockExit(Action.UnlockExit action);
    R visitPushPlayerTo(Action.PushPlayerTo action);
    R visitSetNpcState(Action.SetNpcState action);
    R visitPauseNpc(Action.PauseNpc action);
    R visitSetNpcActive(Action.SetNpcActive action);
    R visitApplyStatus(Action.ApplyStatus action);
    R visitRemoveStatus(Action.RemoveStatus action);
    R visitSetTriggerEnabled(Action.SetTriggerEnabled action);
    R visitScheduleIn(Action.ScheduleIn action);
    R visitScheduleAt(Action.ScheduleAt action);
}
